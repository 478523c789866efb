/**
 * AMR node model: {@link eu.fbk.amr2rdf.node.Node} trees with re-entrant (DAG) links, copy
 * semantics and cycle-safe traversal.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.node;

