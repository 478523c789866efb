package eu.fbk.amr2rdf.translation;

import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static lexical knowledge used by the translation engine: namespace prefixes, closed word lists
 * (adjectives, demonstratives, pronouns, conjunctions), entity types of concepts and special
 * verbs.
 * <p>
 * The default glossary is loaded once from the bundled resources {@code namespaces},
 * {@code words.tsv}, {@code entity-types.tsv} and {@code special-verbs.tsv}, in the same package
 * of this class.
 * </p>
 */
public final class Glossary {

    private static final Logger LOGGER = LoggerFactory.getLogger(Glossary.class);

    @Nullable
    private static Glossary defaultGlossary = null;

    private final Map<String, String> namespaces;

    private final Map<String, WordCategory> words;

    private final Map<String, EntityType> entityTypes;

    private final Map<String, SpecialVerb> specialVerbs;

    /**
     * Categories of closed-class words.
     */
    public enum WordCategory {

        ADJECTIVE,

        DEMONSTRATIVE,

        PERSON,

        MALE,

        FEMALE,

        THING,

        CONJUNCTION;

        /**
         * Returns whether the category denotes a pronoun.
         *
         * @return true for pronoun categories
         */
        public boolean isPronoun() {
            return this == PERSON || this == MALE || this == FEMALE || this == THING;
        }

    }

    /**
     * Class associated to a concept.
     */
    public static final class EntityType {

        private final String concept;

        private final String typeName;

        private final boolean direct;

        public EntityType(final String concept, final String typeName, final boolean direct) {
            this.concept = Preconditions.checkNotNull(concept);
            this.typeName = Preconditions.checkNotNull(typeName);
            this.direct = direct;
        }

        public String getConcept() {
            return this.concept;
        }

        public String getTypeName() {
            return this.typeName;
        }

        /**
         * Returns whether individuals of the concept are typed directly with the class, rather
         * than with a FRED class declared as its subclass.
         *
         * @return true for direct typing
         */
        public boolean isDirect() {
            return this.direct;
        }

        @Override
        public String toString() {
            return this.concept + (this.direct ? " a " : " subClassOf ") + this.typeName;
        }

    }

    public Glossary(final Map<String, String> namespaces, final Map<String, WordCategory> words,
            final Iterable<EntityType> entityTypes, final Iterable<SpecialVerb> specialVerbs) {
        final Map<String, EntityType> typeMap = Maps.newHashMap();
        for (final EntityType type : entityTypes) {
            typeMap.put(type.getConcept(), type);
        }
        final Map<String, SpecialVerb> verbMap = Maps.newHashMap();
        for (final SpecialVerb verb : specialVerbs) {
            verbMap.put(verb.getVerb(), verb);
        }
        this.namespaces = ImmutableMap.copyOf(namespaces);
        this.words = ImmutableMap.copyOf(words);
        this.entityTypes = ImmutableMap.copyOf(typeMap);
        this.specialVerbs = ImmutableMap.copyOf(verbMap);
    }

    public static synchronized Glossary getDefault() {
        if (defaultGlossary == null) {
            try {
                defaultGlossary = load(Tables.resource("namespaces"),
                        Tables.resource("words.tsv"), Tables.resource("entity-types.tsv"),
                        Tables.resource("special-verbs.tsv"));
            } catch (final IOException ex) {
                throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
            }
        }
        return defaultGlossary;
    }

    public static Glossary load(final URL namespacesURL, final URL wordsURL,
            final URL entityTypesURL, final URL specialVerbsURL) throws IOException {

        final Map<String, String> namespaces = Maps.newLinkedHashMap();
        for (final List<String> row : Tables.read(namespacesURL, 2)) {
            namespaces.put(row.get(0), row.get(1));
        }

        final Map<String, WordCategory> words = Maps.newHashMap();
        final List<EntityType> types = Lists.newArrayList();
        final List<SpecialVerb> verbs = Lists.newArrayList();
        try {
            for (final List<String> row : Tables.read(wordsURL, 2)) {
                words.put(row.get(0),
                        WordCategory.valueOf(row.get(1).toUpperCase(Locale.ROOT)));
            }
            for (final List<String> row : Tables.read(entityTypesURL, 3)) {
                types.add(new EntityType(row.get(0), row.get(1), "type".equals(row.get(2))));
            }
            for (final List<String> row : Tables.read(specialVerbsURL, 3)) {
                verbs.add(SpecialVerb.parse(row));
            }
        } catch (final IllegalArgumentException ex) {
            throw new IOException("Invalid glossary table: " + ex.getMessage(), ex);
        }

        LOGGER.debug("Loaded glossary: {} namespaces, {} words, {} entity types, "
                + "{} special verbs", namespaces.size(), words.size(), types.size(),
                verbs.size());
        return new Glossary(namespaces, words, types, verbs);
    }

    /**
     * Returns the prefix to namespace bindings, in declaration order.
     *
     * @return an immutable map
     */
    public Map<String, String> getNamespaces() {
        return this.namespaces;
    }

    @Nullable
    public WordCategory getWordCategory(final String word) {
        return this.words.get(word);
    }

    public boolean isAdjective(final String word) {
        return this.words.get(word) == WordCategory.ADJECTIVE;
    }

    public boolean isDemonstrative(final String word) {
        return this.words.get(word) == WordCategory.DEMONSTRATIVE;
    }

    public boolean isConjunction(final String word) {
        return this.words.get(word) == WordCategory.CONJUNCTION;
    }

    @Nullable
    public EntityType getEntityType(final String concept) {
        return this.entityTypes.get(concept);
    }

    @Nullable
    public SpecialVerb getSpecialVerb(final String concept) {
        return this.specialVerbs.get(concept);
    }

    @Override
    public String toString() {
        return "Glossary (" + this.namespaces.size() + " namespaces, " + this.words.size()
                + " words, " + this.entityTypes.size() + " entity types, "
                + this.specialVerbs.size() + " special verbs)";
    }

}
