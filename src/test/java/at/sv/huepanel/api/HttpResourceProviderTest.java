package at.sv.huepanel.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URL;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Slf4j
class HttpResourceProviderTest {
    private static final String KEY = "application-key";

    private HttpResourceProviderImpl provider;
    private MockWebServer mockServer;
    private URL url;

    @BeforeEach
    void setUp() throws IOException {
        OkHttpClient client = new OkHttpClient.Builder()
                .readTimeout(Duration.ofMillis(500))
                .build();
        provider = new HttpResourceProviderImpl(client, 2);
        mockServer = new MockWebServer();
        mockServer.start();
        url = mockServer.url("/clip/v2/resource/light").url();
    }

    @AfterEach
    void tearDown() {
        shutdownIgnoringException();
    }

    private void shutdownIgnoringException() {
        try {
            mockServer.shutdown();
        } catch (IOException e) {
            log.error("MockWebServer shutdown error (ignored): {}", e.getMessage());
        }
    }

    @Test
    void get_success_returnsBody_sendsApplicationKeyHeader() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setBody("test"));

        String resource = provider.getResource(url, KEY);

        assertThat(resource).isEqualTo("test");
        RecordedRequest request = mockServer.takeRequest();
        assertThat(request.getHeader("hue-application-key")).isEqualTo(KEY);
        assertThat(request.getPath()).isEqualTo("/clip/v2/resource/light");
    }

    @Test
    void get_serverDown_throwsBridgeConnectionFailure() {
        shutdownIgnoringException();

        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(BridgeConnectionFailure.class);
    }

    @Test
    void get_readTimeout_throwsBridgeConnectionFailure() {
        mockServer.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(BridgeConnectionFailure.class);
    }

    @Test
    void code_404_throwsResourceNotFoundException() {
        mockStatusCode(404, "Not found");

        assertThatThrownBy(() -> provider.getResource(url, KEY))
                .isInstanceOf(ResourceNotFoundException.class)
                .isInstanceOf(ApiFailure.class)
                .hasMessageContaining("Resource not found: Not found");
    }

    @Test
    void code_401_throwsAuthenticationFailure() {
        mockStatusCode(401, "");

        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(BridgeAuthenticationFailure.class);
    }

    @Test
    void code_403_throwsAuthenticationFailure() {
        mockStatusCode(403, "");

        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(BridgeAuthenticationFailure.class);
    }

    @Test
    void code_429_rateLimit_throwsApiFailure() {
        mockStatusCode(429, "Description");

        assertThatThrownBy(() -> provider.getResource(url, KEY))
                .isInstanceOf(ApiFailure.class)
                .hasMessageContaining("Rate limit exceeded");
    }

    @Test
    void code_500_serverError_throwsApiFailure() {
        mockStatusCode(500, "Description");

        assertThatThrownBy(() -> provider.getResource(url, KEY))
                .isInstanceOf(ApiFailure.class)
                .hasMessageContaining("Server error: Description");
    }

    @Test
    void code_unexpected_410_connectionFailure() {
        mockStatusCode(410, "Description");

        assertThatThrownBy(() -> provider.getResource(url, KEY))
                .isInstanceOf(BridgeConnectionFailure.class)
                .hasMessageContaining("Failed");
    }

    @Test
    void permitsAreReleased_afterFailures() {
        mockStatusCode(500, "Description");
        mockStatusCode(500, "Description");
        mockServer.enqueue(new MockResponse().setBody("ok"));

        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(ApiFailure.class);
        assertThatThrownBy(() -> provider.getResource(url, KEY)).isInstanceOf(ApiFailure.class);
        assertThat(provider.getResource(url, KEY)).isEqualTo("ok");
    }

    private void mockStatusCode(int code, String body) {
        mockServer.enqueue(new MockResponse().setResponseCode(code).setBody(body));
    }
}
