package io.rerankbench.core.client;

import io.rerankbench.api.client.ClientConfig;
import io.rerankbench.api.client.ClientHandle;
import io.rerankbench.api.client.HandleReleaseException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client handle backed by an {@link OkHttpClient} with its own connection pool and dispatcher.
 * <p>
 * {@link #release()} cancels outstanding calls, shuts the dispatcher down and evicts every pooled connection,
 * after which the handle rejects further requests.
 */
public class HttpClientHandle implements ClientHandle {

    private static final Logger log = LoggerFactory.getLogger(HttpClientHandle.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final ClientConfig config;
    private final OkHttpClient httpClient;
    private final AtomicBoolean released = new AtomicBoolean(false);

    HttpClientHandle(ClientConfig config, OkHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public ClientConfig config() {
        return config;
    }

    /**
     * POST a JSON body to a path below the configured endpoint. The configured timeout bounds the whole call.
     */
    public JsonResponse postJson(String path, String body) throws IOException {
        if (released.get()) {
            throw new IllegalStateException("Client handle for " + config.endpoint() + " has been released");
        }
        Request request = new Request.Builder()
                .url(config.resolve(path))
                .header("Accept", "application/json")
                .post(RequestBody.create(body, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            return new JsonResponse(response.code(), responseBody != null ? responseBody.string() : "");
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return connections currently held by this handle's pool, idle or in use
     */
    int connectionCount() {
        return httpClient.connectionPool().connectionCount();
    }

    boolean dispatcherTerminated() {
        return httpClient.dispatcher().executorService().isTerminated();
    }

    @Override
    public void release() throws HandleReleaseException {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        httpClient.dispatcher().cancelAll();
        ExecutorService dispatcher = httpClient.dispatcher().executorService();
        dispatcher.shutdown();
        httpClient.connectionPool().evictAll();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
                throw new HandleReleaseException("HTTP dispatcher for " + config.endpoint()
                        + " did not terminate in time");
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
            throw new HandleReleaseException("Interrupted while releasing HTTP client for " + config.endpoint(), e);
        }
        log.debug("Released HTTP client for {}", config.endpoint());
    }
}
