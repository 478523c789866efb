package eu.fbk.amr2rdf.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the Framester schema.
 *
 * @see <a href="https://w3id.org/framester/schema/">vocabulary specification</a>
 */
public final class FSCHEMA {

    /** Recommended prefix for the vocabulary namespace: "fschema". */
    public static final String PREFIX = "fschema";

    /** Vocabulary namespace: "https://w3id.org/framester/schema/". */
    public static final String NAMESPACE = "https://w3id.org/framester/schema/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property fschema:subsumedUnder. */
    public static final URI SUBSUMED_UNDER = createURI("subsumedUnder");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private FSCHEMA() {
    }

}
