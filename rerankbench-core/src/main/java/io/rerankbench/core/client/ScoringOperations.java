package io.rerankbench.core.client;

import io.rerankbench.api.operation.Operation;
import io.rerankbench.api.operation.OperationDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Benchmark operations against the scoring service. Each operation sends the same query and documents
 * on every call and fails when the response does not have the expected shape.
 */
public class ScoringOperations {

    public static final String DEFAULT_QUERY = "What is the capital of China?";
    public static final String DEFAULT_MODEL = "qwen3-reranker";

    private static final List<String> BASE_DOCUMENTS = List.of(
            "Shanghai is a large city in China.",
            "The capital of China is Beijing.",
            "Guangzhou is a major city in southern China.",
            "China has a long history and rich culture.",
            "Beijing is known for the Forbidden City.");

    private final ScoringClient client;
    private final String query;
    private final List<String> documents;

    public ScoringOperations(ScoringClient client, String query, List<String> documents) {
        this.client = Objects.requireNonNull(client, "client");
        this.query = Objects.requireNonNull(query, "query");
        this.documents = List.copyOf(documents);
        if (this.documents.isEmpty()) {
            throw new IllegalArgumentException("At least one document is required");
        }
    }

    /**
     * Synthetic documents cycling through a fixed set of sentences, each tagged with its index.
     */
    public static List<String> sampleDocuments(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Document count must not be negative");
        }
        List<String> docs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            docs.add(BASE_DOCUMENTS.get(i % BASE_DOCUMENTS.size()) + " (doc_id=" + i + ")");
        }
        return docs;
    }

    /**
     * Rerank call; fails when the service ranks nothing.
     */
    public Operation<HttpClientHandle> rerank(Integer topN) {
        return handle -> {
            RerankResult result = client.rerank(handle, query, documents, topN);
            if (result.ranked().isEmpty()) {
                throw new ScoringServiceException("empty rerank result");
            }
        };
    }

    /**
     * Score call; fails unless exactly one score per document comes back.
     */
    public Operation<HttpClientHandle> score(String model) {
        return handle -> {
            List<Double> scores = client.score(handle, model, query, documents);
            if (scores.size() != documents.size()) {
                throw new ScoringServiceException(
                        "score len mismatch: " + scores.size() + " != " + documents.size());
            }
        };
    }

    /**
     * The standard pair of benchmarked operations, {@code rerank} then {@code score}.
     */
    public List<OperationDefinition<HttpClientHandle>> standard(Integer topN, String model) {
        return List.of(
                new OperationDefinition<>("rerank", rerank(topN)),
                new OperationDefinition<>("score", score(model)));
    }

    public String query() {
        return query;
    }

    public List<String> documents() {
        return documents;
    }
}
