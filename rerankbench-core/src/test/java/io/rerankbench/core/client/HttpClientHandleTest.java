package io.rerankbench.core.client;

import io.rerankbench.api.client.ClientConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientHandleTest {

    @Test
    void shouldPostJsonBelowEndpoint() throws Exception {
        try (var service = new FakeScoringService()) {
            HttpClientHandle handle = new HttpClientFactory().create(ClientConfig.of(service.endpoint() + "/", null));

            JsonResponse response = handle.postJson("score", "{\"text_1\":\"q\",\"text_2\":[\"a\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"data\"");
            handle.release();
        }
    }

    @Test
    void releaseShouldCloseEveryPooledConnection() throws Exception {
        try (var service = new FakeScoringService()) {
            HttpClientFactory factory = new HttpClientFactory();
            List<HttpClientHandle> handles = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                HttpClientHandle handle = factory.create(ClientConfig.of(service.endpoint(), Duration.ofSeconds(5)));
                handle.postJson("rerank", "{\"query\":\"q\",\"documents\":[\"a\"]}");
                handles.add(handle);
            }
            assertThat(handles).allSatisfy(h -> assertThat(h.connectionCount()).isPositive());

            for (HttpClientHandle handle : handles) {
                handle.release();
            }

            assertThat(handles).allSatisfy(h -> {
                assertThat(h.connectionCount()).isZero();
                assertThat(h.dispatcherTerminated()).isTrue();
            });
        }
    }

    @Test
    void releaseShouldBeIdempotent() throws Exception {
        HttpClientHandle handle = new HttpClientFactory().create(ClientConfig.defaults());

        handle.release();

        assertThat(handle.isReleased()).isTrue();
        assertThatCode(handle::release).doesNotThrowAnyException();
    }

    @Test
    void releasedHandleShouldRejectRequests() throws Exception {
        HttpClientHandle handle = new HttpClientFactory()
                .create(ClientConfig.of("http://127.0.0.1:1/v1", Duration.ofSeconds(1)));
        handle.release();

        assertThatThrownBy(() -> handle.postJson("rerank", "{}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("has been released");
    }

    @Test
    void handleShouldKeepItsConfig() throws Exception {
        ClientConfig config = ClientConfig.of("http://127.0.0.1:9/v1", Duration.ofSeconds(3));
        HttpClientHandle handle = new HttpClientFactory().create(config);

        assertThat(handle.config()).isEqualTo(config);
        handle.release();
    }
}
