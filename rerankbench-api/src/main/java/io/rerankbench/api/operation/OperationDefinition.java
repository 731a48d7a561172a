package io.rerankbench.api.operation;

import io.rerankbench.api.client.ClientHandle;

import java.util.Objects;

/**
 * A named operation, e.g. {@code rerank} or {@code score}. The name is used in scenario labels and metrics.
 */
public record OperationDefinition<H extends ClientHandle>(String name, Operation<? super H> operation) {

    public OperationDefinition {
        Objects.requireNonNull(operation, "operation");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
    }
}
