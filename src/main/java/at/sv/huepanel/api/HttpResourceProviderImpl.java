package at.sv.huepanel.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URL;
import java.util.concurrent.Semaphore;

@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    static final String APPLICATION_KEY_HEADER = "hue-application-key";

    private final OkHttpClient httpClient;
    private final Semaphore concurrentRequests;

    public HttpResourceProviderImpl(OkHttpClient httpClient, int maxConcurrentRequests) {
        this.httpClient = httpClient;
        concurrentRequests = new Semaphore(maxConcurrentRequests, true);
    }

    @Override
    public String getResource(URL url, String applicationKey) {
        log.trace("Get: {}", url);
        return performCall(getRequest(url, applicationKey));
    }

    private static Request getRequest(URL url, String applicationKey) {
        return new Request.Builder()
                .url(url)
                .header(APPLICATION_KEY_HEADER, applicationKey)
                .build();
    }

    private String performCall(Request request) {
        acquirePermit(request);
        try (Response response = callHttpClient(request)) {
            assertSuccessful(response);
            return getBody(response);
        } catch (IOException e) {
            log.debug("Failed '{}': {}", request.url(), e.getMessage());
            throw new BridgeConnectionFailure("Failed '" + request.url() + "'", e);
        } finally {
            concurrentRequests.release();
        }
    }

    private void acquirePermit(Request request) {
        try {
            concurrentRequests.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeConnectionFailure("Interrupted while waiting to call '" + request.url() + "'",
                    new InterruptedIOException(e.getMessage()));
        }
    }

    private Response callHttpClient(Request request) throws IOException {
        return httpClient.newCall(request).execute();
    }

    private static void assertSuccessful(Response response) throws IOException {
        if (response.code() == 401 || response.code() == 403) {
            throw new BridgeAuthenticationFailure();
        }
        if (response.code() == 404) {
            throw new ResourceNotFoundException("Resource not found: " + getBody(response));
        }
        if (response.code() == 429) {
            throw new ApiFailure("Rate limit exceeded");
        }
        if (response.code() >= 500) {
            throw new ApiFailure("Server error: " + getBody(response));
        }
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected return code " + response + ". " + getBody(response));
        }
    }

    private static String getBody(Response response) throws IOException {
        return response.body().string();
    }
}
