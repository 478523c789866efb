package eu.fbk.amr2rdf;

/**
 * A service producing AMR graphs for natural language sentences.
 * <p>
 * Implementations typically call a remote parsing service. Any failure, including unusable
 * responses, is reported as an {@link UpstreamUnavailableException}; implementations never
 * return a fabricated or partial AMR.
 * </p>
 */
public interface AmrFetcher {

    /**
     * Returns the AMR graph, in Penman notation, of the text specified.
     *
     * @param text
     *            the natural language text
     * @param variant
     *            the name of the parsing service variant to use, implementation specific
     * @return the AMR text, never null or empty
     * @throws UpstreamUnavailableException
     *             if the service cannot be contacted or returns an unusable response
     */
    String fetchAmr(String text, String variant) throws UpstreamUnavailableException;

}
