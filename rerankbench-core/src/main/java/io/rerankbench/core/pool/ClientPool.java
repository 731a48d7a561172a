package io.rerankbench.core.pool;

import io.rerankbench.api.client.ClientConfig;
import io.rerankbench.api.client.ClientFactory;
import io.rerankbench.api.client.ClientHandle;
import io.rerankbench.api.client.HandleReleaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caches a single live client handle keyed by its {@link ClientConfig}.
 * <p>
 * Requests for the cached config return the cached handle through a lock-free read. A request for a
 * different config retires the cached handle and installs a new one under the pool lock, so at most one
 * handle is live per pool instance and the old handle is released before the new one becomes visible.
 * <p>
 * Handles returned by {@link #acquire} stay owned by the pool. Callers must not keep them across
 * configuration changes.
 *
 * @param <H> the handle type
 */
public class ClientPool<H extends ClientHandle> {

    private static final Logger log = LoggerFactory.getLogger(ClientPool.class);

    private final ClientFactory<? extends H> factory;
    private final Object lock = new Object();
    private final AtomicLong createdCount = new AtomicLong(0);
    private final AtomicLong releasedCount = new AtomicLong(0);

    private volatile H cached;

    public ClientPool(ClientFactory<? extends H> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Return the handle for {@code config}, creating it (and retiring any handle for another config)
     * when needed.
     *
     * @throws io.rerankbench.api.client.HandleCreationException if the factory cannot construct the handle
     */
    public H acquire(ClientConfig config) {
        Objects.requireNonNull(config, "config");

        H current = cached;
        if (current != null && current.config().equals(config)) {
            return current;
        }

        synchronized (lock) {
            current = cached;
            if (current != null) {
                if (current.config().equals(config)) {
                    return current;
                }
                log.info("Client config changed from {} to {}, retiring cached handle",
                        current.config().endpoint(), config.endpoint());
                cached = null;
                releaseQuietly(current);
            }

            H created = factory.create(config);
            createdCount.incrementAndGet();
            cached = created;
            log.info("Created client handle for {} (timeout {}ms)", config.endpoint(), config.timeout().toMillis());
            return created;
        }
    }

    /**
     * Release the cached handle, if any, and clear the slot. Safe to call repeatedly.
     */
    public void releaseAll() {
        synchronized (lock) {
            H current = cached;
            if (current != null) {
                cached = null;
                releaseQuietly(current);
                log.info("Released client handle for {}", current.config().endpoint());
            }
        }
    }

    /**
     * @return the factory this pool creates handles with
     */
    public ClientFactory<? extends H> factory() {
        return factory;
    }

    /**
     * @return the config of the currently cached handle, if any
     */
    public Optional<ClientConfig> currentConfig() {
        H current = cached;
        return current != null ? Optional.of(current.config()) : Optional.empty();
    }

    /**
     * @return number of handles this pool has constructed
     */
    public long createdCount() {
        return createdCount.get();
    }

    /**
     * @return number of handles this pool has retired, whether or not their release succeeded
     */
    public long releasedCount() {
        return releasedCount.get();
    }

    private void releaseQuietly(H handle) {
        releasedCount.incrementAndGet();
        try {
            handle.release();
        } catch (HandleReleaseException e) {
            log.warn("Ignoring failure while releasing client handle for {}: {}",
                    handle.config().endpoint(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Ignoring unexpected failure while releasing client handle for {}",
                    handle.config().endpoint(), e);
        }
    }
}
