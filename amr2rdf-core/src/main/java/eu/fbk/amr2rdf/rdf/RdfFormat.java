package eu.fbk.amr2rdf.rdf;

import java.util.List;
import java.util.Locale;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import org.openrdf.rio.RDFFormat;

import eu.fbk.amr2rdf.SerializationException;

/**
 * The RDF serialization formats supported by {@link RdfWriter}.
 */
public enum RdfFormat {

    /** Turtle. */
    TURTLE(RDFFormat.TURTLE, "turtle", "ttl"),

    /** N-Triples. */
    NTRIPLES(RDFFormat.NTRIPLES, "nt", "ntriples", "n-triples"),

    /** RDF/XML. */
    RDFXML(RDFFormat.RDFXML, "xml", "rdfxml", "rdf/xml", "rdf"),

    /** Notation 3. */
    N3(RDFFormat.N3, "n3"),

    /** JSON-LD, written in compact form. */
    JSONLD(RDFFormat.JSONLD, "json-ld", "jsonld");

    private final RDFFormat rioFormat;

    private final List<String> names;

    private RdfFormat(final RDFFormat rioFormat, final String... names) {
        this.rioFormat = rioFormat;
        this.names = ImmutableList.copyOf(names);
    }

    public RDFFormat getRioFormat() {
        return this.rioFormat;
    }

    /**
     * Returns the names accepted by {@link #forName(String)} for this format, the first being
     * the canonical one.
     *
     * @return the names
     */
    public List<String> getNames() {
        return this.names;
    }

    /**
     * Returns the format with the name specified (case insensitive).
     *
     * @param name
     *            the format name, e.g. {@code turtle}, {@code nt}, {@code xml}, {@code n3},
     *            {@code json-ld}
     * @return the corresponding format
     * @throws SerializationException
     *             if no supported format has that name
     */
    public static RdfFormat forName(final String name) {
        final String key = name.trim().toLowerCase(Locale.ROOT);
        for (final RdfFormat format : values()) {
            if (format.names.contains(key)) {
                return format;
            }
        }
        throw new SerializationException("Unsupported RDF format '" + name + "' (supported: "
                + Joiner.on(", ").join(values()) + ")");
    }

    @Override
    public String toString() {
        return this.names.get(0);
    }

}
