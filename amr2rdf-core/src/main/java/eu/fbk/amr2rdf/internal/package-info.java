/**
 * Internal helpers shared by the modules of the project; not part of the public API.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.internal;
