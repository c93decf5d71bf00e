package io.cleanapi.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CallInput")
class CallInputTest {

    @Test
    @DisplayName("only supplied slots are reported, including an explicit null payload")
    void suppliedSlots() {
        CallInput input = CallInput.builder()
                .pathParam("id", 1)
                .payload(null)
                .build();

        assertThat(input.suppliedSlots()).containsExactlyInAnyOrder(Slot.PATH_PARAMS, Slot.PAYLOAD);
        assertThat(CallInput.empty().suppliedSlots()).isEmpty();
    }

    @Test
    @DisplayName("an empty map is still a supplied slot")
    void emptyMapIsSupplied() {
        CallInput input = CallInput.builder().searchParams(Map.of()).build();

        assertThat(input.suppliedSlots()).containsExactly(Slot.SEARCH_PARAMS);
        assertThat(input.searchParams()).isEmpty();
    }

    @Test
    @DisplayName("maps are copied and read-only")
    void defensiveCopies() {
        Map<String, Object> source = new HashMap<>();
        source.put("q", "a");
        CallInput input = CallInput.builder().searchParams(source).build();
        source.put("q", "changed");

        assertThat(input.searchParams()).containsEntry("q", "a");
        assertThatThrownBy(() -> input.searchParams().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("toBuilder keeps every slot and the signal")
    void toBuilderRoundTrip() {
        CancellationSignal signal = new CancellationSignal();
        CallInput input = CallInput.builder()
                .pathParam("id", 1)
                .extra("x")
                .signal(signal)
                .build();

        CallInput copy = input.toBuilder().build();

        assertThat(copy).isEqualTo(input);
        assertThat(copy.signal()).isSameAs(signal);
        assertThat(copy.get(Slot.EXTRA)).isEqualTo("x");
    }

    @Test
    @DisplayName("get() refuses output slots")
    void getRejectsOutputSlots() {
        assertThatThrownBy(() -> CallInput.empty().get(Slot.DTO)).isInstanceOf(IllegalArgumentException.class);
    }
}
