/**
 * AMR to RDF translation: pipeline entry point ({@link eu.fbk.amr2rdf.Amr2Rdf}), configuration,
 * error types and collaborator interfaces.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf;

