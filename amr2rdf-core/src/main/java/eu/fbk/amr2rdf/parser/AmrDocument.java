package eu.fbk.amr2rdf.parser;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.node.Node;

/**
 * The result of parsing an AMR text: the root node, the variable bindings and the diagnostics
 * of the problems recovered while parsing.
 */
public final class AmrDocument {

    private final String text;

    private final Node root;

    private final Map<String, Node> bindings;

    private final List<Diagnostic> diagnostics;

    AmrDocument(final String text, final Node root, final Map<String, Node> bindings,
            final List<Diagnostic> diagnostics) {
        this.text = Preconditions.checkNotNull(text);
        this.root = Preconditions.checkNotNull(root);
        this.bindings = ImmutableMap.copyOf(bindings);
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    /**
     * Returns the normalized AMR text that was parsed.
     *
     * @return the normalized text
     */
    public String getText() {
        return this.text;
    }

    public Node getRoot() {
        return this.root;
    }

    /**
     * Returns the node bound to the variable specified.
     *
     * @param var
     *            the variable
     * @return the bound node, or null if the variable is not bound
     */
    @Nullable
    public Node getNode(final String var) {
        return this.bindings.get(var);
    }

    /**
     * Returns the variable bindings, in declaration order.
     *
     * @return an immutable variable to node map
     */
    public Map<String, Node> getBindings() {
        return this.bindings;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }

    @Override
    public String toString() {
        return PenmanWriter.write(this.root, false);
    }

}
