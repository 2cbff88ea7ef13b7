package at.sv.huepanel.api.hue;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.time.Duration;

/**
 * Creates the https client used for all bridges. Hue bridges are addressed by their local IP and present a
 * self-signed certificate issued for their bridge id, so neither the chain nor the host name can be validated.
 */
@Slf4j
public final class HueHttpsClientFactory {

    private HueHttpsClientFactory() {
    }

    public static OkHttpClient createHttpsClient(Duration requestTimeout) throws GeneralSecurityException {
        log.debug("Accepting self-signed bridge certificates.");
        X509TrustManager trustManager = createTrustAllTrustManager();
        SSLContext sslContext = createSSLContext(trustManager);
        return new OkHttpClient.Builder()
                .sslSocketFactory(sslContext.getSocketFactory(), trustManager)
                .hostnameVerifier((hostname, session) -> true)
                .connectTimeout(requestTimeout)
                .readTimeout(requestTimeout)
                .callTimeout(requestTimeout)
                .build();
    }

    private static X509TrustManager createTrustAllTrustManager() {
        return new X509TrustManager() {
            @Override
            public void checkClientTrusted(java.security.cert.X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(java.security.cert.X509Certificate[] chain, String authType) {
            }

            @Override
            public java.security.cert.X509Certificate[] getAcceptedIssuers() {
                return new java.security.cert.X509Certificate[]{};
            }
        };
    }

    private static SSLContext createSSLContext(X509TrustManager trustManager) throws GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{trustManager}, null);
        return context;
    }
}
