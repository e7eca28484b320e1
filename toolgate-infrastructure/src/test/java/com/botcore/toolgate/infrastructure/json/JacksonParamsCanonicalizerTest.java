package com.botcore.toolgate.infrastructure.json;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonParamsCanonicalizerTest {

    private final JacksonParamsCanonicalizer canonicalizer = new JacksonParamsCanonicalizer();

    @Test
    void keyOrderDoesNotMatter() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("symbol", "BTCUSDT");
        a.put("quantity", 0.5);
        a.put("side", "BUY");

        Map<String, Object> b = new LinkedHashMap<>();
        b.put("side", "BUY");
        b.put("symbol", "BTCUSDT");
        b.put("quantity", 0.5);

        assertThat(canonicalizer.canonicalize(a))
                .isEqualTo(canonicalizer.canonicalize(b))
                .isEqualTo("{\"quantity\":0.5,\"side\":\"BUY\",\"symbol\":\"BTCUSDT\"}");
    }

    @Test
    void nestedMapsAreSortedToo() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("tp", 2);
        inner.put("sl", 1);

        String json = canonicalizer.canonicalize(Map.of("levels", inner, "tags", List.of("b", "a")));

        assertThat(json).isEqualTo("{\"levels\":{\"sl\":1,\"tp\":2},\"tags\":[\"b\",\"a\"]}");
    }

    @Test
    void nullOrEmptyIsEmptyObject() {
        assertThat(canonicalizer.canonicalize(null)).isEqualTo("{}");
        assertThat(canonicalizer.canonicalize(Map.of())).isEqualTo("{}");
    }
}
