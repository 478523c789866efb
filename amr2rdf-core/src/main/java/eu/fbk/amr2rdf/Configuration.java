package eu.fbk.amr2rdf;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Immutable configuration of the AMR to RDF pipeline.
 * <p>
 * Default values are read from the {@code amr2rdf.properties} classpath resource and can be
 * overridden with system properties prefixed by {@value #PROPERTY_PREFIX} (e.g.,
 * {@code -Deu.fbk.amr2rdf.maxDepth=200}), or programmatically via {@link #builder()}.
 * </p>
 */
public final class Configuration {

    /** Prefix of system properties overriding default values. */
    public static final String PROPERTY_PREFIX = "eu.fbk.amr2rdf.";

    private static final Properties DEFAULTS = loadDefaults();

    @Nullable
    private static Configuration defaultConfiguration = null;

    private final String namespace;

    private final int maxDepth;

    private final int maxNodes;

    private final boolean topicEnabled;

    private final String format;

    private Configuration(final Builder builder) {
        this.namespace = MoreObjects.firstNonNull(builder.namespace, property("namespace"));
        this.maxDepth = MoreObjects.firstNonNull(builder.maxDepth,
                Integer.parseInt(property("maxDepth")));
        this.maxNodes = MoreObjects.firstNonNull(builder.maxNodes,
                Integer.parseInt(property("maxNodes")));
        this.topicEnabled = MoreObjects.firstNonNull(builder.topicEnabled,
                Boolean.parseBoolean(property("topic")));
        this.format = MoreObjects.firstNonNull(builder.format, property("format"));
        Preconditions.checkArgument(this.namespace.endsWith("#") || this.namespace.endsWith("/"),
                "Invalid namespace (must end with '#' or '/'): %s", this.namespace);
        Preconditions.checkArgument(this.maxDepth > 0, "Invalid max depth: %s", this.maxDepth);
        Preconditions.checkArgument(this.maxNodes > 0, "Invalid max nodes: %s", this.maxNodes);
    }

    private static Properties loadDefaults() {
        final Properties properties = new Properties();
        final URL url = Configuration.class.getResource("amr2rdf.properties");
        if (url == null) {
            throw new Error("Missing resource 'amr2rdf.properties'");
        }
        try (InputStream stream = url.openStream()) {
            properties.load(stream);
        } catch (final IOException ex) {
            throw new Error("Cannot load default configuration: " + ex.getMessage(), ex);
        }
        return properties;
    }

    private static String property(final String key) {
        final String value = Strings.emptyToNull(System.getProperty(PROPERTY_PREFIX + key));
        return value != null ? value.trim() : DEFAULTS.getProperty(key).trim();
    }

    /**
     * Returns the default configuration, built from the properties resource and system
     * properties at the time of the first call.
     *
     * @return the default configuration
     */
    public static synchronized Configuration getDefault() {
        if (defaultConfiguration == null) {
            defaultConfiguration = builder().build();
        }
        return defaultConfiguration;
    }

    /**
     * Returns the namespace of minted individuals, classes and fallback predicates (prefix
     * {@code fred}).
     *
     * @return the namespace
     */
    public String getNamespace() {
        return this.namespace;
    }

    public int getMaxDepth() {
        return this.maxDepth;
    }

    public int getMaxNodes() {
        return this.maxNodes;
    }

    /**
     * Returns whether a topic marker is emitted for documents without verbs.
     *
     * @return true if enabled
     */
    public boolean isTopicEnabled() {
        return this.topicEnabled;
    }

    /**
     * Returns the name of the default output format.
     *
     * @return the format name, e.g. {@code turtle}
     */
    public String getFormat() {
        return this.format;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("namespace", this.namespace)
                .add("maxDepth", this.maxDepth).add("maxNodes", this.maxNodes)
                .add("topic", this.topicEnabled).add("format", this.format).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        @Nullable
        String namespace;

        @Nullable
        Integer maxDepth;

        @Nullable
        Integer maxNodes;

        @Nullable
        Boolean topicEnabled;

        @Nullable
        String format;

        Builder() {
        }

        public Builder namespace(@Nullable final String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder maxDepth(@Nullable final Integer maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxNodes(@Nullable final Integer maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder topicEnabled(@Nullable final Boolean topicEnabled) {
            this.topicEnabled = topicEnabled;
            return this;
        }

        public Builder format(@Nullable final String format) {
            this.format = format;
            return this;
        }

        public Configuration build() {
            return new Configuration(this);
        }

    }

}
