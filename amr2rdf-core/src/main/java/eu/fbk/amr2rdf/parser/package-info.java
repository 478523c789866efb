/**
 * Parsing of AMR graphs in Penman notation into {@link eu.fbk.amr2rdf.node.Node} trees, and
 * rendering of trees back to Penman notation.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.parser;

