/**
 * HTTP client for remote text-to-AMR parsing services.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.amr2rdf.client;
