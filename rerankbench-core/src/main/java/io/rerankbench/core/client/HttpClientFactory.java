package io.rerankbench.core.client;

import io.rerankbench.api.client.ClientConfig;
import io.rerankbench.api.client.ClientFactory;
import io.rerankbench.api.client.HandleCreationException;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates {@link HttpClientHandle}s, each with its own connection pool and dispatcher so that releasing one
 * handle never affects another.
 */
public class HttpClientFactory implements ClientFactory<HttpClientHandle> {

    private static final AtomicInteger HANDLE_COUNTER = new AtomicInteger(0);
    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Override
    public HttpClientHandle create(ClientConfig config) {
        int id = HANDLE_COUNTER.incrementAndGet();
        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "rerankbench-http-" + id);
            t.setDaemon(true);
            return t;
        });
        try {
            Duration timeout = config.timeout();
            OkHttpClient httpClient = new OkHttpClient.Builder()
                    .dispatcher(new Dispatcher(executor))
                    .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
                    .connectTimeout(timeout.compareTo(MAX_CONNECT_TIMEOUT) <= 0 ? timeout : MAX_CONNECT_TIMEOUT)
                    .readTimeout(timeout)
                    .writeTimeout(timeout)
                    .callTimeout(timeout)
                    .build();
            return new HttpClientHandle(config, httpClient);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw new HandleCreationException("Failed to create HTTP client for " + config.endpoint(), e);
        }
    }
}
