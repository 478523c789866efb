/**
 * Vocabulary constants of the ontologies referenced by the generated RDF.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.vocabulary;

