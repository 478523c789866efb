package eu.fbk.amr2rdf.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the default FRED domain namespace, where individuals, classes and fallback
 * properties are minted. The namespace can be changed through
 * {@code eu.fbk.amr2rdf.Configuration}; these constants always refer to the default one.
 *
 * @see <a href="http://www.ontologydesignpatterns.org/ont/fred/domain.owl">vocabulary specification</a>
 */
public final class FRED {

    /** Recommended prefix for the vocabulary namespace: "fred". */
    public static final String PREFIX = "fred";

    /** Vocabulary namespace: "http://www.ontologydesignpatterns.org/ont/fred/domain.owl#". */
    public static final String NAMESPACE = "http://www.ontologydesignpatterns.org/ont/fred/domain.owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class fred:Person. */
    public static final URI PERSON = createURI("Person");

    /** Class fred:Topic. */
    public static final URI TOPIC = createURI("Topic");

    // PROPERTIES

    /** Property fred:of. */
    public static final URI OF = createURI("of");

    // INDIVIDUALS

    /** Individual fred:Male. */
    public static final URI MALE = createURI("Male");

    /** Individual fred:Female. */
    public static final URI FEMALE = createURI("Female");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private FRED() {
    }

}
