package eu.fbk.amr2rdf;

import javax.annotation.Nullable;

import org.openrdf.model.Model;

/**
 * A post-processor augmenting the visible graph of a translation, e.g., with word sense
 * disambiguation or entity linking triples.
 * <p>
 * Enrichers receive an unmodifiable snapshot of the graph and the source text, and return a new
 * graph. Callers use
 * {@link eu.fbk.amr2rdf.translation.Translation#enrich(Enricher, String)}, which falls back to
 * the original graph if the enricher fails or returns null, so that a failing enricher never
 * produces a partial graph.
 * </p>
 */
public interface Enricher {

    /**
     * Returns the augmented version of the graph specified.
     *
     * @param graph
     *            an unmodifiable snapshot of the visible graph
     * @param text
     *            the natural language text the graph was produced from, possibly empty
     * @return the augmented graph
     * @throws Exception
     *             on failure
     */
    @Nullable
    Model enrich(Model graph, String text) throws Exception;

}
