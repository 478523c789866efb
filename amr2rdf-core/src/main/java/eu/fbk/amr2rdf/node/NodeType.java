package eu.fbk.amr2rdf.node;

/**
 * Classification of a {@code Node}, driving how the translation engine renders it in RDF.
 */
public enum NodeType {

    /** Noun-like concept, rendered as an individual of a FRED class. */
    NOUN,

    /** Verb-like concept (concept name with a numeric sense suffix), rendered as an event. */
    VERB,

    /** Role or constant leaf (literal, number, bare symbol) with no individual of its own. */
    OTHER,

    /** Final RDF-facing node, rendered directly as a class (e.g., modifier adjectives). */
    FRED

}
