/**
 * Command line front end ({@link eu.fbk.amr2rdf.tool.Main}).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.tool;
