package eu.fbk.amr2rdf.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the Boxing vocabulary of logical and modal qualifiers.
 *
 * @see <a href="http://www.ontologydesignpatterns.org/ont/boxer/boxing.owl">vocabulary specification</a>
 */
public final class BOXING {

    /** Recommended prefix for the vocabulary namespace: "boxing". */
    public static final String PREFIX = "boxing";

    /** Vocabulary namespace: "http://www.ontologydesignpatterns.org/ont/boxer/boxing.owl#". */
    public static final String NAMESPACE = "http://www.ontologydesignpatterns.org/ont/boxer/boxing.owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class boxing:Conjunct. */
    public static final URI CONJUNCT = createURI("Conjunct");

    /** Class boxing:Disjunct. */
    public static final URI DISJUNCT = createURI("Disjunct");

    // PROPERTIES

    /** Property boxing:hasTruthValue. */
    public static final URI HAS_TRUTH_VALUE = createURI("hasTruthValue");

    /** Property boxing:hasModality. */
    public static final URI HAS_MODALITY = createURI("hasModality");

    // INDIVIDUALS

    /** Individual boxing:False. */
    public static final URI FALSE = createURI("False");

    /** Individual boxing:Necessary. */
    public static final URI NECESSARY = createURI("Necessary");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private BOXING() {
    }

}
