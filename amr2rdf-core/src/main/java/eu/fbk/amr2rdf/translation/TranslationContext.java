package eu.fbk.amr2rdf.translation;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.node.Couple;
import eu.fbk.amr2rdf.node.Node;
import eu.fbk.amr2rdf.rdf.RdfWriter;

/**
 * Mutable state of a single translation: minted names, per-word occurrence counters, predicates
 * used so far, the triple writer and the diagnostics collected. A context is created for each
 * call to {@link Translator#translate(Node)} and never shared.
 */
final class TranslationContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationContext.class);

    private final Node root;

    private final RdfWriter writer;

    private final Map<String, Couple> couples;

    private final Map<Long, Value> values;

    private final Map<Long, Node> modifiers;

    private final Map<URI, Boolean> predicates;

    private final List<Diagnostic> diagnostics;

    TranslationContext(final Node root, final RdfWriter writer,
            final Iterable<Diagnostic> diagnostics) {
        this.root = root;
        this.writer = writer;
        this.couples = Maps.newHashMap();
        this.values = Maps.newHashMap();
        this.modifiers = Maps.newHashMap();
        this.predicates = Maps.newLinkedHashMap();
        this.diagnostics = Lists.newArrayList(diagnostics);
    }

    Node getRoot() {
        return this.root;
    }

    RdfWriter getWriter() {
        return this.writer;
    }

    /**
     * Returns the local name for a new occurrence of the word specified: {@code word} the first
     * time, {@code word_2}, {@code word_3}, ... afterwards.
     */
    String occurrence(final String word) {
        final Couple couple = this.couples.get(word);
        if (couple == null) {
            final Couple created = new Couple(word);
            this.couples.put(word, created);
            return created.getLocalName();
        }
        couple.increment();
        return couple.getLocalName();
    }

    @Nullable
    Value getValue(final Node node) {
        return this.values.get(node.getId());
    }

    void setValue(final Node node, final Value value) {
        this.values.put(node.getId(), value);
    }

    // the :mod child combined with its head into a composite class, e.g. StoneHouse
    @Nullable
    Node getModifier(final Node head) {
        return this.modifiers.get(head.getId());
    }

    void setModifier(final Node head, final Node modifier) {
        this.modifiers.put(head.getId(), modifier);
    }

    void emit(final Resource subject, final URI predicate, final Value object,
            final boolean visible) {
        this.writer.emit(subject, predicate, object, visible);
        if (visible) {
            final Boolean objectProperty = this.predicates.get(predicate);
            this.predicates.put(predicate, object instanceof Resource
                    || objectProperty != null && objectProperty);
        }
    }

    /**
     * Returns the predicates used in the visible graph, each mapped to true if used at least
     * once with a resource object.
     */
    Map<URI, Boolean> getPredicates() {
        return this.predicates;
    }

    void diagnose(final Diagnostic.Kind kind, final Node node, @Nullable final String relation,
            final String message) {
        final Diagnostic diagnostic = new Diagnostic(kind, node.getId(), relation, message);
        this.diagnostics.add(diagnostic);
        LOGGER.debug("{}", diagnostic);
    }

    List<Diagnostic> getDiagnostics() {
        return ImmutableList.copyOf(this.diagnostics);
    }

}
