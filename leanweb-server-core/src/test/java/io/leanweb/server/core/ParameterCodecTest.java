package io.leanweb.server.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ParameterCodecTest {

    @Test
    void decodesPairsInOrder() {
        Map<String, String> parsed = ParameterCodec.decode("k1=v1&k2=v2");
        assertThat(parsed).containsExactly(Map.entry("k1", "v1"), Map.entry("k2", "v2"));
    }

    @Test
    void laterDuplicateWins() {
        assertThat(ParameterCodec.decode("a=1&a=2")).containsExactly(Map.entry("a", "2"));
    }

    @Test
    void emptyAndNullInputYieldEmptyMap() {
        assertThat(ParameterCodec.decode("")).isEmpty();
        assertThat(ParameterCodec.decode(null)).isEmpty();
    }

    @Test
    void segmentWithoutEqualsIsKeyWithEmptyValue() {
        assertThat(ParameterCodec.decode("flag&x=")).containsEntry("flag", "").containsEntry("x", "");
    }

    @Test
    void splitsOnFirstEqualsOnly() {
        assertThat(ParameterCodec.decode("expr=a=b")).containsEntry("expr", "a=b");
    }

    @Test
    void decodesPercentAndPlus() {
        assertThat(ParameterCodec.decode("user=a%40b.com&name=J+Doe"))
                .containsEntry("user", "a@b.com")
                .containsEntry("name", "J Doe");
    }

    @Test
    void keepsMalformedEscapeAsWritten() {
        assertThat(ParameterCodec.decode("p=100%&q=%zz")).containsEntry("p", "100%").containsEntry("q", "%zz");
    }

    @Test
    void skipsEmptySegments() {
        assertThat(ParameterCodec.decode("&a=1&&b=2&")).containsExactly(Map.entry("a", "1"), Map.entry("b", "2"));
    }

    @Test
    void decodesIntoExistingMapOverwritingCollisions() {
        Map<String, String> into = new LinkedHashMap<>();
        into.put("debug", "1");
        into.put("username", "query");
        Map<String, String> result = ParameterCodec.decode("username=abc&password=123", into);
        assertThat(result).isSameAs(into);
        assertThat(result).containsOnly(
                Map.entry("debug", "1"), Map.entry("username", "abc"), Map.entry("password", "123"));
    }
}
