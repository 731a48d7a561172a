package io.rerankbench.api.operation;

import io.rerankbench.api.client.ClientHandle;

/**
 * One unit of benchmarked work: builds a request, performs one request/response cycle through the
 * handle and validates the response shape. Any failure is signalled by throwing.
 *
 * @param <H> the handle type the operation talks through
 */
@FunctionalInterface
public interface Operation<H extends ClientHandle> {

    void execute(H handle) throws Exception;
}
