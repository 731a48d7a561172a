package io.rerankbench.core.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a rerank call.
 *
 * @param ranked        items in the order returned by the service (descending relevance)
 * @param alignedScores one entry per input document; {@code null} for documents the service did not return
 */
public record RerankResult(List<RerankItem> ranked, List<Double> alignedScores) {

    public RerankResult {
        ranked = List.copyOf(ranked);
        alignedScores = Collections.unmodifiableList(new ArrayList<>(alignedScores));
    }

    public static RerankResult empty() {
        return new RerankResult(List.of(), List.of());
    }
}
