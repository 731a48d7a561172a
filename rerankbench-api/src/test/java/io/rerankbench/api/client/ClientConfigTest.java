package io.rerankbench.api.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    @Test
    void defaultsShouldPointAtLocalService() {
        ClientConfig config = ClientConfig.defaults();

        assertThat(config.endpoint()).isEqualTo("http://127.0.0.1:11438/v1");
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void nullArgumentsShouldFallBackToDefaults() {
        assertThat(ClientConfig.of(null, null)).isEqualTo(ClientConfig.defaults());
        assertThat(ClientConfig.of("http://host/v1", null).timeout()).isEqualTo(ClientConfig.DEFAULT_TIMEOUT);
    }

    @Test
    void trailingSlashesShouldNotAffectEquality() {
        var a = ClientConfig.of("http://host:8080/v1/", Duration.ofSeconds(5));
        var b = ClientConfig.of("http://host:8080/v1", Duration.ofSeconds(5));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.endpoint()).isEqualTo("http://host:8080/v1");
    }

    @Test
    void timeoutShouldBePartOfIdentity() {
        var a = ClientConfig.of("http://host/v1", Duration.ofSeconds(5));

        assertThat(a).isNotEqualTo(a.withTimeout(Duration.ofSeconds(6)));
        assertThat(a.withEndpoint("http://other/v1").timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void shouldResolvePathsBelowEndpoint() {
        var config = ClientConfig.of("http://host/v1//", null);

        assertThat(config.resolve("rerank")).isEqualTo("http://host/v1/rerank");
        assertThat(config.resolve("/score")).isEqualTo("http://host/v1/score");
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ClientConfig.of("  / ", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.of("http://host", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.of("http://host", Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClientConfig(null, Duration.ofSeconds(1)))
                .isInstanceOf(NullPointerException.class);
    }
}
