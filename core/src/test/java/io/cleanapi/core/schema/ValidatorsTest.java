package io.cleanapi.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cleanapi.core.error.ValidationException;
import io.cleanapi.core.error.ValidationIssue;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Validators")
class ValidatorsTest {

    @Test
    @DisplayName("check() wraps a function and has no raw schema by default")
    void checkWithoutSchema() {
        Validator<Integer> validator = Validators.check(data -> Integer.parseInt(String.valueOf(data)));

        assertThat(validator.validate("42")).isEqualTo(42);
        assertThat(validator.rawSchema()).isEmpty();
    }

    @Test
    @DisplayName("check() can expose a raw schema")
    void checkWithSchema() {
        Map<String, Object> schema = Map.of("type", "integer");
        Validator<Object> validator = Validators.check(data -> data, schema);

        assertThat(validator.rawSchema()).contains(schema);
    }

    @Test
    @DisplayName("instanceOf rejects other types")
    void instanceOf() {
        Validator<String> validator = Validators.instanceOf(String.class);

        assertThat(validator.validate("a")).isEqualTo("a");
        assertThatThrownBy(() -> validator.validate(1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Expected String, got Integer");
    }

    @Test
    @DisplayName("requiredKeys reports each missing key")
    void requiredKeys() {
        Map<String, Object> data = new HashMap<>();
        data.put("a", 1);
        data.put("b", null);

        assertThatThrownBy(() -> Validators.requiredKeys("a", "b", "c").validate(data))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).issues())
                        .extracting(ValidationIssue::pathString)
                        .containsExactly("b", "c"));
    }
}
