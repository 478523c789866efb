package eu.fbk.amr2rdf.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the FRED quantifiers vocabulary.
 *
 * @see <a href="http://www.ontologydesignpatterns.org/ont/fred/quantifiers.owl">vocabulary specification</a>
 */
public final class QUANT {

    /** Recommended prefix for the vocabulary namespace: "quant". */
    public static final String PREFIX = "quant";

    /** Vocabulary namespace: "http://www.ontologydesignpatterns.org/ont/fred/quantifiers.owl#". */
    public static final String NAMESPACE = "http://www.ontologydesignpatterns.org/ont/fred/quantifiers.owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property quant:hasDeterminer. */
    public static final URI HAS_DETERMINER = createURI("hasDeterminer");

    /** Property quant:hasQuantifier. */
    public static final URI HAS_QUANTIFIER = createURI("hasQuantifier");

    // INDIVIDUALS

    /** Individual quant:multiple. */
    public static final URI MULTIPLE = createURI("multiple");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private QUANT() {
    }

}
