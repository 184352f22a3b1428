package io.leanweb.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpMethodTest {

    @Test
    void parseIgnoresCaseAndWhitespace() {
        assertThat(HttpMethod.parse("post")).isEqualTo(HttpMethod.POST);
        assertThat(HttpMethod.parse(" Get ")).isEqualTo(HttpMethod.GET);
    }

    @Test
    void parseRejectsUnknownVerb() {
        assertThatThrownBy(() -> HttpMethod.parse("BREW"))
                .isInstanceOf(LeanWebException.UnsupportedMethod.class)
                .hasMessageContaining("BREW");
    }

    @Test
    void parseRejectsMissingVerb() {
        assertThatThrownBy(() -> HttpMethod.parse(null)).isInstanceOf(LeanWebException.UnsupportedMethod.class);
        assertThatThrownBy(() -> HttpMethod.parse("")).isInstanceOf(LeanWebException.UnsupportedMethod.class);
    }
}
