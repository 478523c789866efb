package eu.fbk.amr2rdf.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.AmrFetcher;
import eu.fbk.amr2rdf.UpstreamUnavailableException;

/**
 * {@link AmrFetcher} calling remote text-to-AMR services over HTTP.
 * <p>
 * Each supported variant is bound to an {@link Endpoint}. The built-in variants are:
 * </p>
 * <ul>
 * <li>{@code spring} - the SPRING parser hosted at ISTC-CNR (GET, response field
 * {@code penman});</li>
 * <li>{@code spring-uni} - the SPRING parser hosted at Sapienza University (GET, response field
 * {@code penman});</li>
 * <li>{@code usea} - the USeA multilingual parser (POST of a {@code sentence} JSON object,
 * response field {@code amr_graph}).</li>
 * </ul>
 * <p>
 * Endpoints can be added or replaced through the {@link Builder}. Connection errors, non-2xx
 * responses, non-JSON bodies and missing or empty AMR fields are all reported as
 * {@link UpstreamUnavailableException}. Instances are thread safe and should be closed to
 * release pooled connections.
 * </p>
 */
public final class HttpAmrFetcher implements AmrFetcher, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpAmrFetcher.class);

    private static final String USER_AGENT = "AMR2RDF/1.0 Apache-HttpClient/4.5";

    private static final int DEFAULT_MAX_CONNECTIONS = 2;

    private static final int DEFAULT_CONNECTION_TIMEOUT = 5000; // 5 sec

    private static final int DEFAULT_SOCKET_TIMEOUT = 60000; // 1 min, parsing is slow

    /** Default endpoints, keyed by variant name. */
    public static final Map<String, Endpoint> DEFAULT_ENDPOINTS = ImmutableMap.of(
            "spring", Endpoint.get("https://arco.istc.cnr.it/spring/text-to-amr", "sentence",
                    "penman", ImmutableMap.of("blinkify", "true")),
            "spring-uni", Endpoint.get("https://nlp.uniroma1.it/spring/api/text-to-amr",
                    "sentence", "penman", ImmutableMap.<String, String>of()),
            "usea", Endpoint.post("https://arco.istc.cnr.it/usea/api/amr", "amr_graph"));

    private final Map<String, Endpoint> endpoints;

    private final PoolingHttpClientConnectionManager connectionManager;

    private final CloseableHttpClient client;

    private final ObjectMapper mapper;

    private HttpAmrFetcher(final Builder builder) {

        final int timeout = MoreObjects.firstNonNull(builder.connectionTimeout,
                DEFAULT_CONNECTION_TIMEOUT);
        final int socketTimeout = MoreObjects.firstNonNull(builder.socketTimeout,
                DEFAULT_SOCKET_TIMEOUT);
        final int maxConnections = MoreObjects.firstNonNull(builder.maxConnections,
                DEFAULT_MAX_CONNECTIONS);
        Preconditions.checkArgument(timeout >= 0, "Invalid connection timeout %s", timeout);
        Preconditions.checkArgument(socketTimeout >= 0, "Invalid socket timeout %s",
                socketTimeout);
        Preconditions.checkArgument(maxConnections > 0, "Invalid max connections %s",
                maxConnections);

        final Map<String, Endpoint> endpoints = Maps.newLinkedHashMap(DEFAULT_ENDPOINTS);
        endpoints.putAll(builder.endpoints);

        // Setup max concurrent connections
        final PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(maxConnections);
        manager.setDefaultMaxPerRoute(maxConnections);
        manager.setValidateAfterInactivity(1000); // validate connection after 1s idle

        // Configure requests
        final RequestConfig requestConfig = RequestConfig.custom() //
                .setExpectContinueEnabled(false) //
                .setConnectionRequestTimeout(timeout) //
                .setConnectTimeout(timeout) //
                .setSocketTimeout(socketTimeout) //
                .build();

        this.endpoints = ImmutableMap.copyOf(endpoints);
        this.connectionManager = manager;
        this.client = HttpClients.custom().setConnectionManager(manager)
                .setDefaultRequestConfig(requestConfig).setUserAgent(USER_AGENT)
                .disableCookieManagement().build();
        this.mapper = new ObjectMapper();
    }

    /**
     * Returns the endpoints of the supported variants.
     *
     * @return an immutable variant to endpoint map
     */
    public Map<String, Endpoint> getEndpoints() {
        return this.endpoints;
    }

    @Override
    public String fetchAmr(final String text, final String variant)
            throws UpstreamUnavailableException {

        Preconditions.checkNotNull(text);
        final Endpoint endpoint = this.endpoints.get(variant);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown AMR service variant '" + variant
                    + "' (supported: " + this.endpoints.keySet() + ")");
        }

        final HttpUriRequest request = newRequest(variant, endpoint, text);
        final long ts = System.currentTimeMillis();
        final String body;
        try (CloseableHttpResponse response = this.client.execute(request)) {
            final int status = response.getStatusLine().getStatusCode();
            final HttpEntity entity = response.getEntity();
            body = entity == null ? "" : EntityUtils.toString(entity, "UTF-8");
            if (status < 200 || status >= 300) {
                throw new UpstreamUnavailableException(variant, "HTTP " + status + " "
                        + response.getStatusLine().getReasonPhrase() + " from "
                        + endpoint.getURL());
            }
        } catch (final UpstreamUnavailableException ex) {
            throw ex;
        } catch (final IOException ex) {
            throw new UpstreamUnavailableException(variant, "Cannot contact "
                    + endpoint.getURL() + ": " + ex.getMessage(), ex);
        }
        LOGGER.debug("Response from {} received in {} ms", variant, System.currentTimeMillis()
                - ts);

        final JsonNode json;
        try {
            json = this.mapper.readTree(body);
        } catch (final JsonProcessingException ex) {
            throw new UpstreamUnavailableException(variant, "Invalid JSON response: "
                    + ex.getOriginalMessage(), ex);
        }
        final JsonNode field = json == null ? null : json.get(endpoint.getField());
        final String amr = field == null || !field.isTextual() ? null : field.asText().trim();
        if (Strings.isNullOrEmpty(amr)) {
            throw new UpstreamUnavailableException(variant, "Missing or empty '"
                    + endpoint.getField() + "' in response");
        }
        return amr;
    }

    private HttpUriRequest newRequest(final String variant, final Endpoint endpoint,
            final String text) throws UpstreamUnavailableException {
        try {
            final HttpUriRequest request;
            if (endpoint.isPost()) {
                final ObjectNode payload = this.mapper.createObjectNode();
                payload.putObject("sentence").put("text", text);
                final HttpPost post = new HttpPost(endpoint.getURL());
                post.setEntity(new StringEntity(this.mapper.writeValueAsString(payload),
                        ContentType.APPLICATION_JSON));
                request = post;
            } else {
                final URIBuilder builder = new URIBuilder(endpoint.getURL());
                for (final Map.Entry<String, String> entry : endpoint.getParameters().entrySet()) {
                    builder.addParameter(entry.getKey(), entry.getValue());
                }
                builder.addParameter(endpoint.getTextParameter(), text);
                request = new HttpGet(builder.build());
            }
            request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
            return request;
        } catch (final URISyntaxException | JsonProcessingException ex) {
            throw new UpstreamUnavailableException(variant, "Cannot build request for "
                    + endpoint.getURL() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        try {
            this.client.close();
        } catch (final IOException ex) {
            LOGGER.warn("Failed to close HTTP client", ex);
        } finally {
            this.connectionManager.shutdown();
        }
    }

    @Override
    public String toString() {
        return "HttpAmrFetcher " + this.endpoints.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        @Nullable
        Integer connectionTimeout;

        @Nullable
        Integer socketTimeout;

        @Nullable
        Integer maxConnections;

        final Map<String, Endpoint> endpoints;

        Builder() {
            this.endpoints = Maps.newLinkedHashMap();
        }

        public Builder connectionTimeout(@Nullable final Integer connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder socketTimeout(@Nullable final Integer socketTimeout) {
            this.socketTimeout = socketTimeout;
            return this;
        }

        public Builder maxConnections(@Nullable final Integer maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder endpoint(final String variant, final Endpoint endpoint) {
            this.endpoints.put(Preconditions.checkNotNull(variant),
                    Preconditions.checkNotNull(endpoint));
            return this;
        }

        public HttpAmrFetcher build() {
            return new HttpAmrFetcher(this);
        }

    }

    /**
     * Location and protocol of a text-to-AMR service.
     */
    public static final class Endpoint {

        private final String url;

        private final boolean post;

        @Nullable
        private final String textParameter;

        private final Map<String, String> parameters;

        private final String field;

        private Endpoint(final String url, final boolean post,
                @Nullable final String textParameter, final Map<String, String> parameters,
                final String field) {
            this.url = Preconditions.checkNotNull(url);
            this.post = post;
            this.textParameter = textParameter;
            this.parameters = ImmutableMap.copyOf(parameters);
            this.field = Preconditions.checkNotNull(field);
        }

        /**
         * Creates an endpoint receiving the text as a query parameter of a GET request.
         *
         * @param url
         *            the service URL
         * @param textParameter
         *            the name of the query parameter carrying the text
         * @param field
         *            the field of the JSON response holding the AMR
         * @param parameters
         *            additional query parameters
         * @return the created endpoint
         */
        public static Endpoint get(final String url, final String textParameter,
                final String field, final Map<String, String> parameters) {
            return new Endpoint(url, false, Preconditions.checkNotNull(textParameter),
                    parameters, field);
        }

        /**
         * Creates an endpoint receiving a JSON {@code {"sentence": {"text": ...}}} object in the
         * body of a POST request.
         *
         * @param url
         *            the service URL
         * @param field
         *            the field of the JSON response holding the AMR
         * @return the created endpoint
         */
        public static Endpoint post(final String url, final String field) {
            return new Endpoint(url, true, null, ImmutableMap.<String, String>of(), field);
        }

        public String getURL() {
            return this.url;
        }

        public boolean isPost() {
            return this.post;
        }

        @Nullable
        public String getTextParameter() {
            return this.textParameter;
        }

        public Map<String, String> getParameters() {
            return this.parameters;
        }

        public String getField() {
            return this.field;
        }

        @Override
        public String toString() {
            return (this.post ? "POST " : "GET ") + this.url + " -> " + this.field;
        }

    }

}
