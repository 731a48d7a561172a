package io.rerankbench.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Client for an OpenAI-compatible rerank/score service ({@code POST /rerank}, {@code POST /score}).
 */
public class ScoringClient {

    private static final Logger log = LoggerFactory.getLogger(ScoringClient.class);
    private static final int MAX_BODY_EXCERPT = 500;

    private final ObjectMapper objectMapper;

    public ScoringClient() {
        this(new ObjectMapper());
    }

    public ScoringClient(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Rerank documents against a query.
     *
     * @param topN number of results to ask for, or {@code null} to let the service decide
     * @return ranked items in service order plus scores aligned to {@code documents}
     */
    public RerankResult rerank(HttpClientHandle handle, String query, List<String> documents, Integer topN)
            throws IOException {
        if (documents.isEmpty()) {
            return RerankResult.empty();
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", query);
        payload.set("documents", objectMapper.valueToTree(documents));
        if (topN != null) {
            payload.put("top_n", topN.intValue());
        }

        JsonNode raw = post(handle, "rerank", payload);
        JsonNode results = raw.path("results");
        if (!results.isArray()) {
            throw new ScoringServiceException("Unexpected /rerank response (results not a list): " + excerpt(raw.toString()));
        }

        List<RerankItem> ranked = new ArrayList<>(results.size());
        Double[] aligned = new Double[documents.size()];
        for (JsonNode r : results) {
            int index = requiredInt(r, "index");
            double score = r.path("relevance_score").asDouble(0.0);
            String text = r.path("document").path("text").asText("");
            if (text.isEmpty() && index >= 0 && index < documents.size()) {
                text = documents.get(index);
            }
            ranked.add(new RerankItem(index, score, text));
            if (index >= 0 && index < aligned.length) {
                aligned[index] = score;
            }
        }
        return new RerankResult(ranked, Arrays.asList(aligned));
    }

    /**
     * Score every document against a query.
     *
     * @param model served model name, or {@code null} to omit it
     * @return scores aligned to {@code documents}
     * @throws ScoringServiceException if the service leaves any document without a score
     */
    public List<Double> score(HttpClientHandle handle, String model, String query, List<String> documents)
            throws IOException {
        if (documents.isEmpty()) {
            return List.of();
        }

        ObjectNode payload = objectMapper.createObjectNode();
        if (model != null) {
            payload.put("model", model);
        }
        payload.put("text_1", query);
        payload.set("text_2", objectMapper.valueToTree(documents));

        JsonNode raw = post(handle, "score", payload);
        JsonNode data = raw.path("data");
        if (!data.isArray()) {
            throw new ScoringServiceException("Unexpected /score response (data not a list): " + excerpt(raw.toString()));
        }

        Double[] aligned = new Double[documents.size()];
        for (JsonNode x : data) {
            int index = requiredInt(x, "index");
            JsonNode score = x.get("score");
            if (score == null || !score.isNumber()) {
                throw new ScoringServiceException("Missing score for index " + index);
            }
            if (index >= 0 && index < aligned.length) {
                aligned[index] = score.asDouble();
            }
        }

        for (int i = 0; i < aligned.length; i++) {
            if (aligned[i] == null) {
                throw new ScoringServiceException("Incomplete scores returned by /score: no score for document "
                        + i + " of " + aligned.length);
            }
        }
        return List.of(aligned);
    }

    private JsonNode post(HttpClientHandle handle, String path, ObjectNode payload)
            throws IOException {
        String url = handle.config().resolve(path);
        JsonResponse response = handle.postJson(path, objectMapper.writeValueAsString(payload));
        String body = response.body() != null ? response.body() : "";

        if (response.statusCode() >= 400) {
            throw new ScoringServiceException("HTTP " + response.statusCode() + " for " + url + ": " + body);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable response from {}: {}", url, e.getOriginalMessage());
            throw new ScoringServiceException("Failed to parse JSON from " + url + "; text=" + excerpt(body), e);
        }
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new ScoringServiceException("Missing or invalid '" + field + "' in " + excerpt(node.toString()));
        }
        return value.asInt();
    }

    private static String excerpt(String text) {
        return text.length() > MAX_BODY_EXCERPT ? text.substring(0, MAX_BODY_EXCERPT) : text;
    }
}
