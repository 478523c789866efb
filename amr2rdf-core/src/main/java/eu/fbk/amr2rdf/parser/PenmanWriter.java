package eu.fbk.amr2rdf.parser;

import java.util.List;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import eu.fbk.amr2rdf.node.Node;

/**
 * Renders {@link Node} trees in Penman notation.
 * <p>
 * A node with a variable is rendered as {@code (var / label :rel child ...)} the first time it
 * is met in pre-order, and as its bare variable afterwards, so that re-entrancy and cycles are
 * preserved. The synthetic root of a multi-sentence document is rendered as its sentences
 * separated by blank lines; a sentence root is always rendered in full at top level, and as its
 * bare variable where another sentence refers to it. Parsing the output of this class yields the
 * same variable bindings and child ordering of the rendered tree.
 * </p>
 */
public final class PenmanWriter {

    private static final int INDENT = 4;

    private PenmanWriter() {
    }

    /**
     * Renders the tree rooted at the node specified.
     *
     * @param root
     *            the root node
     * @param indent
     *            true to put each relation on its own indented line
     * @return the Penman text
     */
    public static String write(final Node root, final boolean indent) {
        final StringBuilder out = new StringBuilder();
        final Set<Long> rendered = Sets.newHashSet();
        if (root.isSynthetic() && root.isConstant()
                && AmrParser.MULTI_SENTENCE.equals(root.getLabel())) {
            final Set<Long> sentences = Sets.newHashSet();
            for (final Node sentence : root.getChildren()) {
                sentences.add(sentence.getId());
            }
            String separator = "";
            for (final Node sentence : root.getChildren()) {
                out.append(separator);
                write(sentence, 0, indent, sentences, rendered, out);
                separator = indent ? "\n\n" : " ";
            }
        } else {
            write(root, 0, indent, ImmutableSet.<Long>of(), rendered, out);
        }
        return out.toString();
    }

    private static void write(final Node node, final int depth, final boolean indent,
            final Set<Long> sentences, final Set<Long> rendered, final StringBuilder out) {

        if (node.isConstant()) {
            if (node.isQuoted() || node.getLabel().isEmpty()) {
                out.append('"').append(node.getLabel()).append('"');
            } else {
                out.append(node.getLabel());
            }
            return;
        }

        if ((depth > 0 && sentences.contains(node.getId())) || !rendered.add(node.getId())) {
            out.append(node.getVar());
            return;
        }

        out.append('(').append(node.getVar()).append(" / ");
        if (node.getLabel().isEmpty() || node.getLabel().indexOf(' ') >= 0) {
            out.append('"').append(node.getLabel()).append('"');
        } else {
            out.append(node.getLabel());
        }
        final List<Node> children = node.getChildren();
        final List<String> relations = node.getChildRelations();
        for (int i = 0; i < children.size(); ++i) {
            if (indent) {
                out.append('\n').append(Strings.repeat(" ", (depth + 1) * INDENT));
            } else {
                out.append(' ');
            }
            out.append(relations.get(i)).append(' ');
            write(children.get(i), depth + 1, indent, sentences, rendered, out);
        }
        out.append(')');
    }

}
