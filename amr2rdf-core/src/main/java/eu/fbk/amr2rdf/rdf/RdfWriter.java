package eu.fbk.amr2rdf.rdf;

import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.Rio;
import org.openrdf.rio.UnsupportedRDFormatException;
import org.openrdf.rio.helpers.BasicWriterSettings;
import org.openrdf.rio.helpers.JSONLDMode;
import org.openrdf.rio.helpers.JSONLDSettings;
import org.openrdf.rio.helpers.XMLWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.SerializationException;

/**
 * Accumulator and serializer of the triples produced by a translation.
 * <p>
 * Triples are emitted either to the <i>visible</i> graph, which is the output of the translation,
 * or to the <i>suppressed</i> graph, which collects scaffolding triples that are computed but never
 * serialized. A triple already in the visible graph is never added to the suppressed one. Both
 * graphs keep insertion order, so that serializing the same graph always produces the same text.
 * </p>
 * <p>
 * Namespace prefixes are bound once, at creation time; only those actually used by the visible
 * graph are declared in the serialized output. Serialization never modifies the graphs.
 * </p>
 */
public final class RdfWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RdfWriter.class);

    private final Map<String, String> namespaces;

    private final Model graph;

    private final Model suppressed;

    /**
     * Creates a new writer with empty graphs and the prefix to namespace bindings specified.
     *
     * @param namespaces
     *            the namespace bindings, whose iteration order is kept
     */
    public RdfWriter(final Map<String, String> namespaces) {
        this.namespaces = ImmutableMap.copyOf(namespaces);
        this.graph = new LinkedHashModel();
        this.suppressed = new LinkedHashModel();
    }

    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    /**
     * Emits a triple to the visible or suppressed graph. A triple is never in both graphs: a
     * visible emission moves a suppressed triple to the visible graph, while a suppressed emission
     * of a visible triple is ignored.
     *
     * @param subject
     *            the subject
     * @param predicate
     *            the predicate
     * @param object
     *            the object
     * @param visible
     *            true to add the triple to the visible graph, false for the suppressed graph
     * @return true if the triple was not already in the target graph
     */
    public boolean emit(final Resource subject, final URI predicate, final Value object,
            final boolean visible) {
        Preconditions.checkNotNull(subject);
        Preconditions.checkNotNull(predicate);
        Preconditions.checkNotNull(object);
        if (visible) {
            this.suppressed.remove(subject, predicate, object);
            return this.graph.add(subject, predicate, object);
        } else if (!this.graph.contains(subject, predicate, object)) {
            return this.suppressed.add(subject, predicate, object);
        }
        return false;
    }

    /**
     * Returns an unmodifiable view of the visible graph.
     *
     * @return the visible graph
     */
    public Model getGraph() {
        return this.graph.unmodifiable();
    }

    /**
     * Returns an unmodifiable view of the suppressed graph.
     *
     * @return the suppressed graph
     */
    public Model getSuppressedGraph() {
        return this.suppressed.unmodifiable();
    }

    /**
     * Serializes the visible graph in the format specified.
     *
     * @param format
     *            the format
     * @return the serialized graph
     * @throws SerializationException
     *             on failure
     */
    public String serialize(final RdfFormat format) {
        final StringWriter writer = new StringWriter();
        serialize(format, writer);
        return writer.toString();
    }

    /**
     * Serializes the visible graph in the format specified to the supplied writer.
     *
     * @param format
     *            the format
     * @param out
     *            the destination, not closed by this method
     * @throws SerializationException
     *             on failure
     */
    public void serialize(final RdfFormat format, final Writer out) {
        write(this.graph, this.namespaces, format, out);
    }

    /**
     * Serializes an arbitrary graph, declaring the namespaces of the bindings specified that are
     * used in the graph.
     *
     * @param graph
     *            the graph to serialize
     * @param namespaces
     *            the prefix to namespace bindings
     * @param format
     *            the format
     * @param out
     *            the destination, not closed by this method
     * @throws SerializationException
     *             on failure
     */
    public static void write(final Iterable<Statement> graph,
            final Map<String, String> namespaces, final RdfFormat format, final Writer out) {

        Preconditions.checkNotNull(format);
        Preconditions.checkNotNull(out);

        try {
            final RDFFormat rioFormat = format.getRioFormat();
            final org.openrdf.rio.RDFWriter writer = Rio.createWriter(rioFormat, out);
            writer.getWriterConfig().set(BasicWriterSettings.PRETTY_PRINT, true);
            writer.getWriterConfig().set(BasicWriterSettings.RDF_LANGSTRING_TO_LANG_LITERAL, true);
            writer.getWriterConfig().set(BasicWriterSettings.XSD_STRING_TO_PLAIN_LITERAL, true);
            if (rioFormat.equals(RDFFormat.RDFXML)) {
                writer.getWriterConfig().set(XMLWriterSettings.INCLUDE_XML_PI, true);
                writer.getWriterConfig().set(XMLWriterSettings.INCLUDE_ROOT_RDF_TAG, true);
            } else if (rioFormat.equals(RDFFormat.JSONLD)) {
                writer.getWriterConfig().set(JSONLDSettings.JSONLD_MODE, JSONLDMode.COMPACT);
            }

            final Set<String> used = usedNamespaces(graph);
            int count = 0;
            writer.startRDF();
            for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
                if (used.contains(entry.getValue())) {
                    writer.handleNamespace(entry.getKey(), entry.getValue());
                }
            }
            for (final Statement statement : graph) {
                writer.handleStatement(statement);
                ++count;
            }
            writer.endRDF();
            LOGGER.debug("{} triples serialized as {}", count, format);

        } catch (final RDFHandlerException | UnsupportedRDFormatException ex) {
            throw new SerializationException("Cannot serialize graph as " + format + ": "
                    + ex.getMessage(), ex);
        }
    }

    private static Set<String> usedNamespaces(final Iterable<Statement> graph) {
        final Set<String> namespaces = Sets.newHashSet();
        for (final Statement statement : graph) {
            addNamespace(statement.getSubject(), namespaces);
            addNamespace(statement.getPredicate(), namespaces);
            addNamespace(statement.getObject(), namespaces);
        }
        return namespaces;
    }

    private static void addNamespace(final Value value, final Set<String> namespaces) {
        if (value instanceof URI) {
            namespaces.add(((URI) value).getNamespace());
        } else if (value instanceof Literal && ((Literal) value).getDatatype() != null) {
            namespaces.add(((Literal) value).getDatatype().getNamespace());
        }
    }

    @Override
    public String toString() {
        return "RdfWriter (" + this.graph.size() + " visible, " + this.suppressed.size()
                + " suppressed triples)";
    }

}
