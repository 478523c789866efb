package eu.fbk.amr2rdf;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.parser.AmrDocument;
import eu.fbk.amr2rdf.parser.AmrParser;
import eu.fbk.amr2rdf.rdf.RdfFormat;
import eu.fbk.amr2rdf.translation.RuleTable;
import eu.fbk.amr2rdf.translation.Translation;
import eu.fbk.amr2rdf.translation.Translator;

/**
 * Entry point of the AMR to RDF pipeline.
 * <p>
 * An {@code Amr2Rdf} instance parses AMR graphs in Penman notation and translates them into
 * FRED-style RDF graphs. When configured with an {@link AmrFetcher}, it can also translate
 * natural language text, obtaining its AMR from a remote service; an optional {@link Enricher}
 * can then post-process the resulting graph. Instances are created with {@link #builder()} and
 * are thread safe, as each call works on its own node tree and translation state.
 * </p>
 * <p>
 * Example:
 * </p>
 *
 * <pre>
 * Amr2Rdf amr2rdf = Amr2Rdf.builder().build();
 * String turtle = amr2rdf.translate("(w / want-01 :arg0 (b / boy))", RdfFormat.TURTLE);
 * </pre>
 */
public final class Amr2Rdf {

    private static final Logger LOGGER = LoggerFactory.getLogger(Amr2Rdf.class);

    private final Configuration configuration;

    private final AmrParser parser;

    private final Translator translator;

    @Nullable
    private final AmrFetcher fetcher;

    @Nullable
    private final Enricher enricher;

    private Amr2Rdf(final Builder builder) {
        this.configuration = MoreObjects.firstNonNull(builder.configuration,
                Configuration.getDefault());
        this.parser = new AmrParser(this.configuration);
        this.translator = new Translator(this.configuration, MoreObjects.firstNonNull(
                builder.ruleTable, RuleTable.getDefault()));
        this.fetcher = builder.fetcher;
        this.enricher = builder.enricher;
        LOGGER.debug("Created {}", this);
    }

    public Configuration getConfiguration() {
        return this.configuration;
    }

    /**
     * Parses and translates the AMR text specified.
     *
     * @param amr
     *            the AMR graph in Penman notation
     * @return the translation, including parse and translation diagnostics
     * @throws MalformedInputException
     *             if the AMR text is structurally unrecoverable
     */
    public Translation translate(final String amr) {
        final AmrDocument document = this.parser.parseDocument(amr);
        return this.translator.translate(document);
    }

    /**
     * Parses and translates the AMR text specified, serializing the visible graph.
     *
     * @param amr
     *            the AMR graph in Penman notation
     * @param format
     *            the output format
     * @return the serialized graph
     * @throws MalformedInputException
     *             if the AMR text is structurally unrecoverable
     * @throws SerializationException
     *             if serialization fails
     */
    public String translate(final String amr, final RdfFormat format) {
        return translate(amr).serialize(format);
    }

    /**
     * Obtains the AMR of the text specified from the configured fetcher, translates it and
     * applies the configured enricher, if any.
     *
     * @param text
     *            the natural language text
     * @param variant
     *            the parsing service variant
     * @return the translation
     * @throws UpstreamUnavailableException
     *             if the AMR cannot be obtained
     * @throws MalformedInputException
     *             if the returned AMR is structurally unrecoverable
     * @throws IllegalStateException
     *             if no fetcher was configured
     */
    public Translation translateText(final String text, final String variant)
            throws UpstreamUnavailableException {
        Preconditions.checkNotNull(text);
        Preconditions.checkNotNull(variant);
        Preconditions.checkState(this.fetcher != null, "No AMR fetcher configured");
        final String amr = this.fetcher.fetchAmr(text, variant);
        LOGGER.debug("AMR for '{}' from {}: {}", text, variant, amr);
        return translate(amr).enrich(this.enricher, text);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("configuration", this.configuration).add("translator", this.translator)
                .add("fetcher", this.fetcher).add("enricher", this.enricher).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        @Nullable
        Configuration configuration;

        @Nullable
        RuleTable ruleTable;

        @Nullable
        AmrFetcher fetcher;

        @Nullable
        Enricher enricher;

        Builder() {
        }

        public Builder configuration(@Nullable final Configuration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder ruleTable(@Nullable final RuleTable ruleTable) {
            this.ruleTable = ruleTable;
            return this;
        }

        public Builder fetcher(@Nullable final AmrFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder enricher(@Nullable final Enricher enricher) {
            this.enricher = enricher;
            return this;
        }

        public Amr2Rdf build() {
            return new Amr2Rdf(this);
        }

    }

}
