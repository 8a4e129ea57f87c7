package io.healthexporter.config;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * Builds the outbound {@link HttpClient} shared by every scrape.
 * Connect timeout and TLS trust come from {@link ExporterConfig}; the client is thread-safe.
 */
@Slf4j
public final class HttpClientFactory {

    static final String DISABLE_HOSTNAME_VERIFICATION_PROPERTY = "jdk.internal.httpclient.disableHostnameVerification";

    private HttpClientFactory() {
        // Utility class
    }

    /**
     * Builds the client for the configured target.
     * <p>
     * Insecure mode also sets the JVM-wide {@code jdk.internal.httpclient.disableHostnameVerification}
     * property. The JDK reads it once, when its HTTP client internals initialise, so it only
     * takes effect if no {@link HttpClient} was built earlier in this JVM. The exporter builds
     * exactly one client at startup, through this method.
     */
    public static HttpClient create(ExporterConfig config) {
        if (config.isInsecureSkipVerify()) {
            disableHostnameVerification();
        }

        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(config.getTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL);

        if (config.isInsecureSkipVerify()) {
            log.warn("TLS certificate and hostname verification disabled for target {}",
                ExporterConfig.redact(config.getTargetUri()));
            builder.sslContext(trustAllContext());
        } else if (config.getCaCertFile() != null) {
            log.info("Trusting CA certificates from {}", config.getCaCertFile());
            builder.sslContext(caContext(config.getCaCertFile()));
        }
        return builder.build();
    }

    static void disableHostnameVerification() {
        System.setProperty(DISABLE_HOSTNAME_VERIFICATION_PROPERTY, "true");
    }

    static SSLContext caContext(String caCertFile) {
        try (InputStream in = Files.newInputStream(Paths.get(caCertFile))) {
            Collection<? extends Certificate> certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
            if (certificates.isEmpty()) {
                throw new IllegalArgumentException("No certificates found in " + caCertFile);
            }
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            int index = 0;
            for (Certificate certificate : certificates) {
                trustStore.setCertificateEntry("ca-" + index++, certificate);
            }
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(trustStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, factory.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to load CA certificates from " + caCertFile, e);
        }
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = new TrustManager[] {
            new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialise insecure TLS context", e);
        }
    }
}
