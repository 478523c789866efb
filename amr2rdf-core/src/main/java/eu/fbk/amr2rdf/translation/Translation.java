package eu.fbk.amr2rdf.translation;

import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.Model;
import org.openrdf.model.impl.LinkedHashModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.Enricher;
import eu.fbk.amr2rdf.node.Node;
import eu.fbk.amr2rdf.rdf.RdfFormat;
import eu.fbk.amr2rdf.rdf.RdfWriter;

/**
 * The result of translating an AMR graph: the visible graph, the suppressed graph of scaffolding
 * triples, the annotated node tree and the diagnostics of recovered problems.
 */
public final class Translation {

    private static final Logger LOGGER = LoggerFactory.getLogger(Translation.class);

    private final Node root;

    private final Model graph;

    private final Model suppressedGraph;

    private final Map<String, String> namespaces;

    private final List<Diagnostic> diagnostics;

    Translation(final Node root, final RdfWriter writer, final List<Diagnostic> diagnostics) {
        this(root, writer.getGraph(), writer.getSuppressedGraph(), writer.getNamespaces(),
                diagnostics);
    }

    private Translation(final Node root, final Model graph, final Model suppressedGraph,
            final Map<String, String> namespaces, final List<Diagnostic> diagnostics) {
        this.root = root;
        this.graph = graph;
        this.suppressedGraph = suppressedGraph;
        this.namespaces = namespaces;
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    /**
     * Returns the annotated node tree the graph was produced from.
     *
     * @return the root node
     */
    public Node getRoot() {
        return this.root;
    }

    /**
     * Returns the visible graph, i.e., the output of the translation.
     *
     * @return an unmodifiable model
     */
    public Model getGraph() {
        return this.graph;
    }

    /**
     * Returns the suppressed graph, holding triples computed but never serialized.
     *
     * @return an unmodifiable model
     */
    public Model getSuppressedGraph() {
        return this.suppressedGraph;
    }

    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }

    /**
     * Serializes the visible graph in the format specified.
     *
     * @param format
     *            the output format
     * @return the serialized graph
     * @throws eu.fbk.amr2rdf.SerializationException
     *             on failure
     */
    public String serialize(final RdfFormat format) {
        final StringWriter writer = new StringWriter();
        serialize(format, writer);
        return writer.toString();
    }

    public void serialize(final RdfFormat format, final Writer writer) {
        RdfWriter.write(this.graph, this.namespaces, format, writer);
    }

    /**
     * Returns a translation whose visible graph is the one returned by the enricher for the
     * current graph and source text. The enricher receives an unmodifiable snapshot of the
     * graph. A null enricher leaves the translation unchanged; if the enricher fails or returns
     * null, a warning is logged and this translation is returned unchanged.
     *
     * @param enricher
     *            the enricher, possibly null
     * @param text
     *            the natural language text the AMR graph was obtained from
     * @return the enriched translation, or this translation
     */
    public Translation enrich(@Nullable final Enricher enricher, final String text) {
        Preconditions.checkNotNull(text);
        if (enricher == null) {
            return this;
        }
        final Model enriched;
        try {
            enriched = enricher.enrich(new LinkedHashModel(this.graph).unmodifiable(), text);
        } catch (final Exception ex) {
            LOGGER.warn("Enrichment failed, keeping the unenriched graph: " + ex.getMessage(),
                    ex);
            return this;
        }
        if (enriched == null) {
            LOGGER.warn("Enricher {} returned no graph, keeping the unenriched graph", enricher);
            return this;
        }
        return new Translation(this.root, new LinkedHashModel(enriched).unmodifiable(),
                this.suppressedGraph, this.namespaces, this.diagnostics);
    }

    @Override
    public String toString() {
        return "Translation (" + this.graph.size() + " triples, " + this.diagnostics.size()
                + " diagnostics)";
    }

}
