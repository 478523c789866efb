package eu.fbk.amr2rdf.node;

/**
 * Processing status of a {@code Node}.
 */
public enum NodeStatus {

    /** Normal node, fully processed. */
    OK,

    /** Node still carrying AMR-specific content not yet mapped to RDF. */
    AMR,

    /** Node affected by a recovered error; excluded from triple emission. */
    ERROR,

    /** Node logically removed from the tree; kept in place to preserve traversal stability. */
    REMOVE

}
