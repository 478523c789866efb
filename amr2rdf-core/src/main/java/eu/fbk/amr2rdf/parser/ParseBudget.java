package eu.fbk.amr2rdf.parser;

/**
 * Per-call bound on the nesting depth and number of nodes of a parsed AMR tree.
 */
final class ParseBudget {

    private final int maxDepth;

    private final int maxNodes;

    private int nodes;

    ParseBudget(final int maxDepth, final int maxNodes) {
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
        this.nodes = 0;
    }

    boolean allowsDepth(final int depth) {
        return depth <= this.maxDepth;
    }

    boolean allowsNode() {
        return this.nodes < this.maxNodes;
    }

    void allocate() {
        ++this.nodes;
    }

    int getNodes() {
        return this.nodes;
    }

    @Override
    public String toString() {
        return this.nodes + "/" + this.maxNodes + " nodes, max depth " + this.maxDepth;
    }

}
