package io.osquerymcp.spring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.osquerymcp.core.OsQueryObjectMappers;
import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.ApiRequest;
import io.osquerymcp.core.client.ClusterConnection;
import io.osquerymcp.core.client.ClusterConnectionResolver;
import io.osquerymcp.core.client.RestOpenSearchClient;
import io.osquerymcp.core.client.UpstreamCallException;
import io.osquerymcp.core.registry.HttpVerb;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * OpenSearch REST client backed by OkHttp.
 *
 * <p>One OkHttpClient is kept per resolved cluster connection; they share the
 * connection pool and dispatcher of a single base client.
 *
 * <p>Non-2xx responses become {@link UpstreamCallException} with the status code.
 * Responses that are not JSON (e.g. hot threads) are returned as text nodes, and an
 * empty body is reported as {@code {"status": <code>}}.
 */
public class OkHttpOpenSearchClient extends RestOpenSearchClient {

    private static final Logger log = LoggerFactory.getLogger(OkHttpOpenSearchClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final ClusterConnectionResolver resolver;
    private final ObjectMapper objectMapper;
    private final OkHttpClient baseClient;
    private final Map<ClusterConnection, OkHttpClient> clients = new ConcurrentHashMap<>();

    public OkHttpOpenSearchClient(ClusterConnectionResolver resolver) {
        this(resolver, new OkHttpClient());
    }

    public OkHttpOpenSearchClient(ClusterConnectionResolver resolver, OkHttpClient baseClient) {
        this.resolver = resolver;
        this.baseClient = baseClient;
        this.objectMapper = OsQueryObjectMappers.create();
    }

    @Override
    public JsonNode execute(ClusterTarget target, ApiRequest request) {
        ClusterConnection connection = resolver.resolve(target);
        Request httpRequest = buildRequest(connection, request);
        log.debug("{} {} on cluster {}", request.method(), httpRequest.url(), connection.name());

        try (Response response = clientFor(connection).newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new UpstreamCallException(
                    "HTTP " + response.code() + ": " + errorReason(response, content), response.code());
            }
            if (content.isBlank()) {
                return objectMapper.createObjectNode().put("status", response.code());
            }
            return parse(content, body.contentType());
        } catch (SocketTimeoutException e) {
            throw new UpstreamCallException("Request to cluster '" + connection.name() + "' timed out", e);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(
                "Request to cluster '" + connection.name() + "' was interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (IOException e) {
            throw new UpstreamCallException(
                "Cannot reach cluster '" + connection.name() + "' at " + connection.url() + ": " + e.getMessage(), e);
        }
    }

    Request buildRequest(ClusterConnection connection, ApiRequest request) {
        HttpUrl base = HttpUrl.parse(stripTrailingSlash(connection.url()) + request.path());
        if (base == null) {
            throw new UpstreamCallException("Invalid OpenSearch URL: " + connection.url() + request.path());
        }
        HttpUrl.Builder url = base.newBuilder();
        request.queryParams().forEach((name, value) -> url.addQueryParameter(name, String.valueOf(value)));

        Request.Builder builder = new Request.Builder()
            .url(url.build())
            .header("Accept", "application/json");
        if (connection.hasCredentials()) {
            builder.header("Authorization",
                Credentials.basic(connection.username(), connection.password() != null ? connection.password() : ""));
        }
        request.headers().forEach(builder::header);

        return builder.method(request.method().name(), requestBody(request)).build();
    }

    private RequestBody requestBody(ApiRequest request) {
        HttpVerb method = request.method();
        JsonNode body = request.body();
        if (method == HttpVerb.GET || method == HttpVerb.HEAD) {
            if (body != null && !body.isNull()) {
                throw new UpstreamCallException(method + " requests cannot carry a body; use POST instead");
            }
            return null;
        }
        if (body == null || body.isNull()) {
            // OkHttp requires a body for POST, PUT and PATCH
            return method == HttpVerb.DELETE ? null : RequestBody.create(new byte[0], JSON);
        }
        String content;
        try {
            content = body.isTextual() ? body.asText() : objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new UpstreamCallException("Cannot serialize request body", e);
        }
        return RequestBody.create(content, JSON);
    }

    private JsonNode parse(String content, MediaType contentType) {
        boolean json = contentType == null || "json".equalsIgnoreCase(contentType.subtype());
        if (json) {
            try {
                return objectMapper.readTree(content);
            } catch (IOException e) {
                log.debug("Response declared as JSON could not be parsed, returning text: {}", e.getMessage());
            }
        }
        return TextNode.valueOf(content);
    }

    private String errorReason(Response response, String content) {
        try {
            JsonNode error = objectMapper.readTree(content).path("error");
            if (error.path("reason").isTextual()) {
                return error.get("reason").asText();
            }
            if (error.isTextual()) {
                return error.asText();
            }
        } catch (IOException | RuntimeException e) {
            log.trace("Error body is not JSON: {}", e.getMessage());
        }
        return !content.isBlank() ? content : response.message();
    }

    private OkHttpClient clientFor(ClusterConnection connection) {
        return clients.computeIfAbsent(connection, c -> baseClient.newBuilder()
            .connectTimeout(c.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(c.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(c.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .build());
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
