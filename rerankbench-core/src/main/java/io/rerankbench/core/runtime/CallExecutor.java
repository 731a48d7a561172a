package io.rerankbench.core.runtime;

import io.micrometer.core.instrument.Clock;
import io.rerankbench.api.client.ClientHandle;
import io.rerankbench.api.operation.Operation;
import io.rerankbench.api.runtime.CallOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Performs one timed call and turns its result into a {@link CallOutcome}.
 * <p>
 * Latency is taken from the monotonic clock immediately around the operation, on failure as well.
 * Nothing thrown by the operation escapes {@link #execute} except a {@link VirtualMachineError}.
 */
public class CallExecutor {

    private static final Logger log = LoggerFactory.getLogger(CallExecutor.class);

    private final Clock clock;

    public CallExecutor() {
        this(Clock.SYSTEM);
    }

    public CallExecutor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <H extends ClientHandle> CallOutcome execute(H handle, Operation<? super H> operation) {
        long start = clock.monotonicTime();
        try {
            operation.execute(handle);
            Duration latency = Duration.ofNanos(clock.monotonicTime() - start);
            return CallOutcome.success(latency);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            Duration latency = Duration.ofNanos(clock.monotonicTime() - start);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String error = describe(e);
            log.debug("Call failed after {}ms: {}", latency.toMillis(), error);
            return CallOutcome.failure(latency, error);
        }
    }

    /**
     * Textual form of a failure: {@code SimpleClassName: message}, or just the class name without a message.
     */
    static String describe(Throwable error) {
        String name = error.getClass().getSimpleName();
        if (name.isEmpty()) {
            name = error.getClass().getName();
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? name : name + ": " + message;
    }
}
