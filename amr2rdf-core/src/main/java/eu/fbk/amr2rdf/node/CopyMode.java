package eu.fbk.amr2rdf.node;

/**
 * Variants of {@link Node#copy(CopyMode)}.
 */
public enum CopyMode {

    /** Copies node fields only, without children. */
    SHALLOW,

    /**
     * Copies the whole subtree with new identities; re-entrant nodes are copied once and shared
     * by the copies of their parents.
     */
    DEEP,

    /**
     * Copies the shape of the subtree (relations and child ordering) with variables, labels and
     * verb senses cleared; copies are flagged as synthetic.
     */
    STRUCTURE_ONLY,

    /** Copies the node and shallow copies of its direct children, without recursing further. */
    CHILDREN_ONLY

}
