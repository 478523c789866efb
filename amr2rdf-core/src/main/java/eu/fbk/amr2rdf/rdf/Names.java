package eu.fbk.amr2rdf.rdf;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import org.openrdf.model.Literal;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.amr2rdf.vocabulary.FRED;

/**
 * URI and literal construction for the generated graph.
 * <p>
 * Names are written as {@code prefix:local} strings in the static tables and resolved against a
 * prefix to namespace table; strings with an unknown prefix or no prefix at all are interpreted as
 * local names in the {@code fred} namespace. Local names are transliterated to ASCII, whitespace
 * is replaced with {@code _} and the remaining URI-unsafe characters are percent-escaped.
 * </p>
 */
public final class Names {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private static final Escaper ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private static final Pattern NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private static final Pattern DATE = Pattern.compile("[0-9]{4}-[0-9]{2}-[0-9]{2}");

    private static final Pattern TIME = Pattern.compile("([01]?[0-9]|2[0-3]):([0-5][0-9])");

    private final Map<String, String> namespaces;

    private final String fredNamespace;

    /**
     * Creates a new instance for the namespace table and FRED namespace specified. The FRED
     * namespace replaces the one bound to prefix {@code fred} in the table, if any.
     *
     * @param namespaces
     *            a prefix to namespace map, whose iteration order is kept
     * @param fredNamespace
     *            the namespace for minted names
     */
    public Names(final Map<String, String> namespaces, final String fredNamespace) {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        builder.put(FRED.PREFIX, Preconditions.checkNotNull(fredNamespace));
        for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
            if (!entry.getKey().equals(FRED.PREFIX)) {
                builder.put(entry);
            }
        }
        this.namespaces = builder.build();
        this.fredNamespace = fredNamespace;
    }

    /**
     * Returns the prefix to namespace table, including the FRED namespace.
     *
     * @return an immutable map
     */
    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    public String getFredNamespace() {
        return this.fredNamespace;
    }

    /**
     * Resolves a {@code prefix:local} name, an absolute URI or a plain local name.
     *
     * @param name
     *            the name to resolve
     * @return the resulting URI
     */
    public URI resolve(final String name) {
        if (name.contains("://")) {
            return FACTORY.createURI(name);
        }
        final int index = name.indexOf(':');
        if (index > 0) {
            final String namespace = this.namespaces.get(name.substring(0, index));
            if (namespace != null) {
                return FACTORY.createURI(namespace + escape(name.substring(index + 1)));
            }
        }
        return fred(name);
    }

    /**
     * Returns the URI in the FRED namespace with the (unescaped) local name specified.
     *
     * @param localName
     *            the local name
     * @return the URI
     */
    public URI fred(final String localName) {
        return FACTORY.createURI(this.fredNamespace + escape(localName));
    }

    /**
     * Returns the FRED class for the concept specified, e.g. {@code fred:Boy} for {@code boy}.
     *
     * @param concept
     *            the concept name
     * @return the class URI
     */
    public URI fredClass(final String concept) {
        return fred(capitalize(concept));
    }

    /**
     * Returns a typed literal for an AMR constant. Quoted strings are always strings; otherwise
     * numbers are {@code xsd:decimal}, {@code YYYY-MM-DD} values {@code xsd:date}, {@code hh:mm}
     * values {@code xsd:time}, and anything else (including rationals) is a string.
     *
     * @param text
     *            the constant text
     * @param quoted
     *            whether the constant was quoted
     * @return the literal
     */
    public static Literal literal(final String text, final boolean quoted) {
        if (!quoted) {
            if (NUMBER.matcher(text).matches()) {
                return FACTORY.createLiteral(text, XMLSchema.DECIMAL);
            } else if (DATE.matcher(text).matches()) {
                return FACTORY.createLiteral(text, XMLSchema.DATE);
            }
            final Matcher matcher = TIME.matcher(text);
            if (matcher.matches()) {
                final String hour = matcher.group(1).length() == 1 ? "0" + matcher.group(1)
                        : matcher.group(1);
                return FACTORY.createLiteral(hour + ":" + matcher.group(2) + ":00",
                        XMLSchema.TIME);
            }
        }
        return FACTORY.createLiteral(text, XMLSchema.STRING);
    }

    /**
     * Returns whether the text specified is rendered as a number by {@link #literal}.
     *
     * @param text
     *            the text
     * @return true for numbers
     */
    public static boolean isNumber(final String text) {
        return NUMBER.matcher(text).matches();
    }

    /**
     * Sanitizes and escapes a local name: diacritics are removed, whitespace runs become
     * {@code _} and URI-unsafe characters are percent-escaped.
     *
     * @param localName
     *            the local name
     * @return the escaped local name
     */
    public static String escape(final String localName) {
        String result = DIACRITICS.matcher(Normalizer.normalize(localName, Normalizer.Form.NFD))
                .replaceAll("");
        result = CharMatcher.whitespace().trimAndCollapseFrom(result, '_');
        return ESCAPER.escape(result);
    }

    public static String capitalize(final String string) {
        return string.isEmpty() ? string : Character.toUpperCase(string.charAt(0))
                + string.substring(1);
    }

}
