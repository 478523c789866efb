package eu.fbk.amr2rdf.translation;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A relation to predicate mapping rule.
 * <p>
 * Each rule belongs to a {@link Category}; categories are evaluated in declaration order, so that
 * e.g. an exact rule for {@code :location} wins over the preposition pattern. {@code EXACT} rules
 * match the relation name verbatim, the others match it against a regular expression whose groups
 * can be referenced in the predicate template as {@code $1}, {@code $2}, .... A rule may further
 * constrain the value of the relation (e.g., {@code :polarity -}), fix the object of the produced
 * triple and mark the triple as hidden, i.e., routed to the suppressed graph.
 * </p>
 */
public final class Rule {

    public enum Category {

        EXACT,

        ARGUMENT,

        OPERATOR,

        PREPOSITION,

        MODIFIER,

        FALLBACK

    }

    /**
     * How a matched edge is rendered.
     */
    public enum Action {

        /** Emit a triple with the rule predicate and the rule object or the mapped value. */
        PROPERTY,

        /** Emit nothing. */
        SKIP,

        /** {@code :domain} edge: the value is typed or qualified by the parent class. */
        DOMAIN,

        /** {@code :name} edge: consumed when minting the named entity. */
        NAME,

        /** {@code :wiki} edge: link to a DBpedia or Wikidata resource. */
        WIKI,

        /** {@code :quant} edge: quantifier or data value. */
        QUANTITY,

        /** {@code :argN} edge: PropBank role. */
        ARGUMENT,

        /** {@code :opN} edge: member, data value or generic association. */
        OPERATOR,

        /** {@code :prep-X} edge: preposition property. */
        PREPOSITION,

        /** {@code :mod} edge: quality, determiner or generic association. */
        MODIFIER,

        /** Any other edge: generic property, reported as unmapped. */
        FALLBACK

    }

    private final Category category;

    private final String relation;

    @Nullable
    private final Pattern pattern;

    @Nullable
    private final String value;

    private final Action action;

    @Nullable
    private final String predicate;

    @Nullable
    private final String object;

    private final boolean hidden;

    /**
     * Creates a new rule.
     *
     * @param category
     *            the category
     * @param relation
     *            the relation name, for {@code EXACT} rules, or a regular expression
     * @param value
     *            the required value of the relation, null if any
     * @param action
     *            the action
     * @param predicate
     *            the predicate name or template, null for actions that do not need it
     * @param object
     *            the fixed object name, null to use the mapped relation value
     * @param hidden
     *            true if produced triples go to the suppressed graph
     */
    public Rule(final Category category, final String relation, @Nullable final String value,
            final Action action, @Nullable final String predicate, @Nullable final String object,
            final boolean hidden) {
        this.category = Preconditions.checkNotNull(category);
        this.relation = Preconditions.checkNotNull(relation).toLowerCase(Locale.ROOT);
        this.pattern = category == Category.EXACT ? null : Pattern.compile(this.relation);
        this.value = value;
        this.action = Preconditions.checkNotNull(action);
        this.predicate = predicate;
        this.object = object;
        this.hidden = hidden;
    }

    static Rule parse(final List<String> row) {
        final String flags = Tables.cell(row, 6);
        return new Rule(Category.valueOf(row.get(0).toUpperCase(Locale.ROOT)), row.get(1),
                Tables.cell(row, 2),
                Action.valueOf(row.get(3).toUpperCase(Locale.ROOT)),
                Tables.cell(row, 4), Tables.cell(row, 5), flags != null
                        && flags.contains("hidden"));
    }

    public Category getCategory() {
        return this.category;
    }

    public String getRelation() {
        return this.relation;
    }

    @Nullable
    public String getValue() {
        return this.value;
    }

    public Action getAction() {
        return this.action;
    }

    @Nullable
    public String getPredicate() {
        return this.predicate;
    }

    @Nullable
    public String getObject() {
        return this.object;
    }

    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * Checks whether the rule applies to the relation and value specified.
     *
     * @param relation
     *            the lowercase relation, e.g. {@code :arg0}
     * @param value
     *            the label of the relation value, null to ignore value constraints
     * @return true on match
     */
    public boolean matches(final String relation, @Nullable final String value) {
        if (this.value != null && !this.value.equals(value)) {
            return false;
        }
        return this.pattern == null ? this.relation.equals(relation) : this.pattern.matcher(
                relation).matches();
    }

    /**
     * Returns the predicate name for the relation specified, replacing group references in the
     * predicate template.
     *
     * @param relation
     *            the matched relation
     * @return the predicate name, e.g. {@code fred:at} for {@code :prep-at}; null if the rule has
     *         no predicate
     */
    @Nullable
    public String expandPredicate(final String relation) {
        if (this.predicate == null || this.pattern == null || this.predicate.indexOf('$') < 0) {
            return this.predicate;
        }
        final Matcher matcher = this.pattern.matcher(relation);
        return matcher.matches() ? matcher.replaceFirst(this.predicate) : this.predicate;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Rule)) {
            return false;
        }
        final Rule other = (Rule) object;
        return this.category == other.category && this.relation.equals(other.relation)
                && Objects.equals(this.value, other.value) && this.action == other.action
                && Objects.equals(this.predicate, other.predicate)
                && Objects.equals(this.object, other.object) && this.hidden == other.hidden;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.category, this.relation, this.value, this.action,
                this.predicate, this.object, this.hidden);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("category", this.category)
                .add("relation", this.relation).add("value", this.value)
                .add("action", this.action).add("predicate", this.predicate)
                .add("object", this.object).add("hidden", this.hidden ? true : null).toString();
    }

}
