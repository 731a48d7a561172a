package io.rerankbench.core.client;

import io.rerankbench.api.client.ClientConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringClientTest {

    private static final List<String> DOCS = List.of("alpha", "beta", "gamma");

    private FakeScoringService service;
    private HttpClientHandle handle;
    private final ScoringClient client = new ScoringClient();

    @BeforeEach
    void setUp() throws Exception {
        service = new FakeScoringService();
        handle = new HttpClientFactory().create(ClientConfig.of(service.endpoint(), Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() throws Exception {
        handle.release();
        service.close();
    }

    @Test
    void rerankShouldSendQueryAndAlignScores() throws Exception {
        RerankResult result = client.rerank(handle, "q", DOCS, 2);

        assertThat(result.ranked()).extracting(RerankItem::index).containsExactly(0, 1);
        assertThat(result.ranked()).extracting(RerankItem::document).containsExactly("alpha", "beta");
        assertThat(result.alignedScores()).containsExactly(1.0, 0.9, null);

        var request = service.requests().get(0);
        assertThat(request.get("query").asText()).isEqualTo("q");
        assertThat(request.get("top_n").asInt()).isEqualTo(2);
        assertThat(request.get("documents")).hasSize(3);
    }

    @Test
    void rerankShouldOmitTopNWhenUnset() throws Exception {
        client.rerank(handle, "q", DOCS, null);

        assertThat(service.requests().get(0).has("top_n")).isFalse();
    }

    @Test
    void rerankShouldFallBackToInputDocumentText() throws Exception {
        service.onRerank(req -> new FakeScoringService.Response(200,
                "{\"results\":[{\"index\":2,\"relevance_score\":0.7}]}"));

        RerankResult result = client.rerank(handle, "q", DOCS, null);

        assertThat(result.ranked()).containsExactly(new RerankItem(2, 0.7, "gamma"));
    }

    @Test
    void rerankShouldRejectResultsThatAreNotAList() {
        service.onRerank(req -> new FakeScoringService.Response(200, "{\"results\":{}}"));

        assertThatThrownBy(() -> client.rerank(handle, "q", DOCS, null))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessageContaining("results not a list");
    }

    @Test
    void rerankShouldRejectItemsWithoutIndex() {
        service.onRerank(req -> new FakeScoringService.Response(200,
                "{\"results\":[{\"relevance_score\":0.7}]}"));

        assertThatThrownBy(() -> client.rerank(handle, "q", DOCS, null))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessageContaining("'index'");
    }

    @Test
    void scoreShouldAlignOutOfOrderData() throws Exception {
        List<Double> scores = client.score(handle, "m", "q", DOCS);

        assertThat(scores).containsExactly(0.5, 0.51, 0.52);
        var request = service.requests().get(0);
        assertThat(request.get("model").asText()).isEqualTo("m");
        assertThat(request.get("text_1").asText()).isEqualTo("q");
        assertThat(request.get("text_2")).hasSize(3);
    }

    @Test
    void scoreShouldOmitModelWhenUnset() throws Exception {
        client.score(handle, null, "q", DOCS);

        assertThat(service.requests().get(0).has("model")).isFalse();
    }

    @Test
    void scoreShouldFailWhenADocumentIsMissing() {
        service.onScore(req -> new FakeScoringService.Response(200,
                "{\"data\":[{\"index\":0,\"score\":0.1},{\"index\":2,\"score\":0.3}]}"));

        assertThatThrownBy(() -> client.score(handle, null, "q", DOCS))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessageStartingWith("Incomplete scores returned by /score");
    }

    @Test
    void scoreShouldFailOnMissingScoreValue() {
        service.onScore(req -> new FakeScoringService.Response(200, "{\"data\":[{\"index\":0}]}"));

        assertThatThrownBy(() -> client.score(handle, null, "q", DOCS))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessage("Missing score for index 0");
    }

    @Test
    void errorStatusShouldCarryStatusUrlAndBody() {
        service.onScore(req -> new FakeScoringService.Response(503, "{\"error\":\"overloaded\"}"));

        assertThatThrownBy(() -> client.score(handle, null, "q", DOCS))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessage("HTTP 503 for " + service.endpoint() + "/score: {\"error\":\"overloaded\"}");
    }

    @Test
    void unparseableBodyShouldBeReported() {
        service.onRerank(req -> new FakeScoringService.Response(200, "<html>gateway</html>"));

        assertThatThrownBy(() -> client.rerank(handle, "q", DOCS, null))
                .isInstanceOf(ScoringServiceException.class)
                .hasMessage("Failed to parse JSON from " + service.endpoint() + "/rerank; text=<html>gateway</html>");
    }

    @Test
    void emptyDocumentsShouldNotHitTheService() throws Exception {
        assertThat(client.rerank(handle, "q", List.of(), 3)).isEqualTo(RerankResult.empty());
        assertThat(client.score(handle, null, "q", List.of())).isEmpty();

        assertThat(service.requestCount()).isZero();
    }
}
