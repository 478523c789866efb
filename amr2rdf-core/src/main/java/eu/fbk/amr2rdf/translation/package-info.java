/**
 * Translation of AMR node trees into FRED-style RDF/OWL graphs.
 * <p>
 * The {@link eu.fbk.amr2rdf.translation.Translator} is driven by static tables bundled as
 * resources of this package: relation rules ({@link eu.fbk.amr2rdf.translation.RuleTable}),
 * PropBank rolesets and roles ({@link eu.fbk.amr2rdf.translation.PropBank}), and namespaces, word
 * lists, entity types and special verbs ({@link eu.fbk.amr2rdf.translation.Glossary}).
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.translation;
