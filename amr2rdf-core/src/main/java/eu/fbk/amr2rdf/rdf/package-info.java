/**
 * RDF output: visible and suppressed graphs, URI minting and serialization through Rio.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.rdf;

