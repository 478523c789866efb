package eu.fbk.amr2rdf.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the DOLCE+DnS Ultralite (DUL) ontology.
 *
 * @see <a href="http://www.ontologydesignpatterns.org/ont/dul/DUL.owl">vocabulary specification</a>
 */
public final class DUL {

    /** Recommended prefix for the vocabulary namespace: "dul". */
    public static final String PREFIX = "dul";

    /** Vocabulary namespace: "http://www.ontologydesignpatterns.org/ont/dul/DUL.owl#". */
    public static final String NAMESPACE = "http://www.ontologydesignpatterns.org/ont/dul/DUL.owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class dul:Event. */
    public static final URI EVENT = createURI("Event");

    /** Class dul:Person. */
    public static final URI PERSON = createURI("Person");

    /** Class dul:Organization. */
    public static final URI ORGANIZATION = createURI("Organization");

    /** Class dul:TimeInterval. */
    public static final URI TIME_INTERVAL = createURI("TimeInterval");

    // PROPERTIES

    /** Property dul:associatedWith. */
    public static final URI ASSOCIATED_WITH = createURI("associatedWith");

    /** Property dul:hasDataValue. */
    public static final URI HAS_DATA_VALUE = createURI("hasDataValue");

    /** Property dul:hasMember. */
    public static final URI HAS_MEMBER = createURI("hasMember");

    /** Property dul:hasQuality. */
    public static final URI HAS_QUALITY = createURI("hasQuality");

    /** Property dul:hasRole. */
    public static final URI HAS_ROLE = createURI("hasRole");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private DUL() {
    }

}
