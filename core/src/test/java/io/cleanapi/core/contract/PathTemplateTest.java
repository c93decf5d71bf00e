package io.cleanapi.core.contract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cleanapi.core.error.ContractDefinitionException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PathTemplate")
class PathTemplateTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("placeholders are collected in order of appearance")
        void collectsPlaceholders() {
            PathTemplate template = PathTemplate.parse("/users/:userId/posts/:postId", "getPost");

            assertThat(template.placeholders()).containsExactly("userId", "postId");
            assertThat(template.hasPlaceholders()).isTrue();
        }

        @Test
        @DisplayName("a literal path has no placeholders")
        void literalPath() {
            assertThat(PathTemplate.parse("/health", "health").placeholders()).isEmpty();
        }

        @Test
        @DisplayName("a colon inside a segment is literal text")
        void colonInsideSegmentIsLiteral() {
            PathTemplate template = PathTemplate.parse("/v1/items:batchGet", "batch");

            assertThat(template.placeholders()).isEmpty();
            assertThat(template.interpolate(Map.of())).isEqualTo("/v1/items:batchGet");
        }

        @Test
        @DisplayName("a path without a leading slash is rejected")
        void rejectsMissingLeadingSlash() {
            assertThatThrownBy(() -> PathTemplate.parse("users/:id", "getUser"))
                    .isInstanceOf(ContractDefinitionException.class)
                    .hasMessageContaining("must start with a '/'")
                    .satisfies(e -> {
                        ContractDefinitionException cde = (ContractDefinitionException) e;
                        assertThat(cde.endpoint()).isEqualTo("getUser");
                        assertThat(cde.pathTemplate()).isEqualTo("users/:id");
                    });
        }

        @Test
        @DisplayName("duplicate placeholders are rejected")
        void rejectsDuplicatePlaceholder() {
            assertThatThrownBy(() -> PathTemplate.parse("/a/:id/b/:id", "dup"))
                    .isInstanceOf(ContractDefinitionException.class)
                    .hasMessageContaining("more than once");
        }

        @Test
        @DisplayName("malformed placeholder names are rejected")
        void rejectsMalformedPlaceholder() {
            assertThatThrownBy(() -> PathTemplate.parse("/a/:", "empty"))
                    .isInstanceOf(ContractDefinitionException.class)
                    .hasMessageContaining("malformed placeholder");
            assertThatThrownBy(() -> PathTemplate.parse("/a/:1abc", "digit"))
                    .isInstanceOf(ContractDefinitionException.class);
        }
    }

    @Nested
    @DisplayName("Interpolation")
    class Interpolation {

        @Test
        @DisplayName("numeric values are stringified")
        void stringifiesNumbers() {
            PathTemplate template = PathTemplate.parse("/users/:id", "getUser");

            assertThat(template.interpolate(Map.of("id", 7))).isEqualTo("/users/7");
        }

        @Test
        @DisplayName("values are percent-encoded as a single segment")
        void encodesValues() {
            PathTemplate template = PathTemplate.parse("/files/:name", "getFile");

            assertThat(template.interpolate(Map.of("name", "a/b c"))).isEqualTo("/files/a%2Fb%20c");
            assertThat(template.interpolate(Map.of("name", "ünï~._-"))).isEqualTo("/files/%C3%BCn%C3%AF~._-");
        }

        @Test
        @DisplayName("null values stringify to 'null'")
        void nullValue() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("id", null);

            assertThat(PathTemplate.parse("/users/:id", "getUser").interpolate(params)).isEqualTo("/users/null");
        }

        @Test
        @DisplayName("trailing literal text after the last placeholder is kept")
        void keepsTrailingLiteral() {
            PathTemplate template = PathTemplate.parse("/users/:id/profile/", "profile");

            assertThat(template.interpolate(Map.of("id", "u1"))).isEqualTo("/users/u1/profile/");
        }

        @Test
        @DisplayName("a missing value is an error")
        void missingValue() {
            PathTemplate template = PathTemplate.parse("/users/:id", "getUser");

            assertThatThrownBy(() -> template.interpolate(Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'id'");
        }
    }
}
