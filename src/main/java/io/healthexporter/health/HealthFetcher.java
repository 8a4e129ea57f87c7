package io.healthexporter.health;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.healthexporter.config.ExporterConfig;
import io.healthexporter.models.HealthSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.healthexporter.config.Constants.CLUSTER_HEALTH_PATH;
import static io.healthexporter.config.Constants.HTTP_STATUS_OK;

/**
 * Fetches and decodes one {@code _cluster/health} response per call.
 * <p>
 * The fetcher keeps no state between calls and does no counter bookkeeping; callers tell
 * failures apart by the {@link HealthFetchException} subtype. The shared {@link HttpClient}
 * owns connect timeout and TLS. The configured timeout bounds the whole exchange, body
 * included.
 */
@Slf4j
public class HealthFetcher {

    private static final byte[] NO_BODY = new byte[0];

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI healthUri;
    private final String authorization;
    private final Duration timeout;

    public HealthFetcher(HttpClient httpClient, URI baseUri, Duration timeout) {
        this(httpClient, defaultObjectMapper(), baseUri, timeout);
    }

    public HealthFetcher(HttpClient httpClient, ObjectMapper objectMapper, URI baseUri, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.healthUri = healthUri(baseUri);
        this.authorization = basicAuthorization(baseUri);
        this.timeout = timeout;
        log.info("HealthFetcher initialized for {}", healthUri);
    }

    /**
     * Strict mapper for health responses: unknown fields are ignored, but trailing content
     * and scalar coercions (quoted numbers, floats into ints, numbers into strings or
     * booleans) are decode errors.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .withCoercionConfig(LogicalType.Textual, config -> config
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
            .withCoercionConfig(LogicalType.Integer, config -> config
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail))
            .withCoercionConfig(LogicalType.Float, config -> config
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail))
            .withCoercionConfig(LogicalType.Boolean, config -> config
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail))
            .build();
    }

    /**
     * Issue a single GET against the health endpoint and decode the body.
     *
     * @return the decoded snapshot
     * @throws TransportException if the request cannot be sent, the connection fails or the
     *                            exchange does not complete within the timeout
     * @throws UnexpectedStatusException if the response status is not 200
     * @throws DecodeException if the body cannot be read or decoded
     */
    public HealthSnapshot fetch() throws HealthFetchException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(healthUri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET();
        if (authorization != null) {
            requestBuilder.header("Authorization", authorization);
        }

        AtomicBoolean headersReceived = new AtomicBoolean();
        HttpResponse.BodyHandler<byte[]> bodyHandler = responseInfo -> {
            headersReceived.set(true);
            // non-200 bodies are drained and dropped
            return responseInfo.statusCode() == HTTP_STATUS_OK
                ? HttpResponse.BodySubscribers.ofByteArray()
                : HttpResponse.BodySubscribers.replacing(NO_BODY);
        };

        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(requestBuilder.build(), bodyHandler);
        HttpResponse<byte[]> response;
        try {
            response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new TransportException(String.format("timed out after %dms getting cluster health from %s",
                timeout.toMillis(), healthUri), e);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException(String.format("interrupted while getting cluster health from %s",
                healthUri), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (headersReceived.get() && cause instanceof IOException) {
                throw new DecodeException("failed to read cluster health response: " + cause.getMessage(), cause);
            }
            throw new TransportException(String.format("failed to get cluster health from %s: %s",
                healthUri, cause.getMessage()), cause);
        }

        if (response.statusCode() != HTTP_STATUS_OK) {
            throw new UnexpectedStatusException(response.statusCode());
        }
        return decode(response.body());
    }

    public URI getHealthUri() {
        return healthUri;
    }

    private HealthSnapshot decode(byte[] body) throws DecodeException {
        try {
            HealthSnapshot snapshot = objectMapper.readValue(body != null ? body : NO_BODY, HealthSnapshot.class);
            // a literal JSON null leaves every field at its zero value
            return snapshot != null ? snapshot : HealthSnapshot.empty();
        } catch (IOException e) {
            throw new DecodeException("failed to decode cluster health response: " + e.getMessage(), e);
        }
    }

    /**
     * Joins the health path onto the base path, collapsing duplicate slashes.
     * Credentials and fragment are dropped; the query string is kept.
     */
    static URI healthUri(URI baseUri) {
        String basePath = baseUri.getPath() != null ? baseUri.getPath() : "";
        String joined = (basePath + CLUSTER_HEALTH_PATH).replaceAll("/{2,}", "/");
        try {
            return new URI(baseUri.getScheme(), null, baseUri.getHost(), baseUri.getPort(),
                joined, baseUri.getQuery(), null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot build cluster health URL from " + ExporterConfig.redact(baseUri), e);
        }
    }

    static String basicAuthorization(URI baseUri) {
        String userInfo = baseUri.getUserInfo();
        if (userInfo == null || userInfo.isEmpty()) {
            return null;
        }
        return "Basic " + Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
    }
}
