package eu.fbk.amr2rdf;

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import eu.fbk.amr2rdf.node.Node;

/**
 * A problem detected and recovered while parsing or translating an AMR graph.
 * <p>
 * Diagnostics are attributed to the node (by id) and, where applicable, to the relation that
 * triggered them. They are collected per request and never affect other requests.
 * </p>
 */
public final class Diagnostic {

    /**
     * Kinds of recovered problems.
     */
    public enum Kind {

        /** A relation value looks like a variable that is never declared. */
        UNRESOLVED_REFERENCE,

        /** A relation or concept has no specific mapping; a generic one was used. */
        UNMAPPED_CONSTRUCT,

        /** A malformed token or structure was repaired or skipped. */
        MALFORMED_NODE,

        /** The parser depth or node budget was exceeded; a subtree was pruned. */
        BUDGET_EXCEEDED

    }

    private final Kind kind;

    private final long nodeId;

    @Nullable
    private final String relation;

    private final String message;

    public Diagnostic(final Kind kind, final long nodeId, @Nullable final String relation,
            final String message) {
        this.kind = Preconditions.checkNotNull(kind);
        this.nodeId = nodeId;
        this.relation = relation;
        this.message = Preconditions.checkNotNull(message);
    }

    public static Diagnostic create(final Kind kind, final Node node, final String message) {
        return new Diagnostic(kind, node.getId(), node.getRelation().isEmpty() ? null
                : node.getRelation(), message);
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the id of the node the problem is attributed to.
     *
     * @return the node id, or 0 if the problem does not concern a specific node
     */
    public long getNodeId() {
        return this.nodeId;
    }

    @Nullable
    public String getRelation() {
        return this.relation;
    }

    public String getMessage() {
        return this.message;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Diagnostic)) {
            return false;
        }
        final Diagnostic other = (Diagnostic) object;
        return this.kind == other.kind && this.nodeId == other.nodeId
                && Objects.equals(this.relation, other.relation)
                && this.message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.nodeId, this.relation, this.message);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("kind", this.kind)
                .add("node", this.nodeId).add("relation", this.relation)
                .add("message", this.message).toString();
    }

}
