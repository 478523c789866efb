package eu.fbk.amr2rdf.translation;

import java.io.IOException;
import java.net.URL;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, immutable table of relation to predicate {@link Rule}s.
 * <p>
 * Rules are kept sorted by {@link Rule.Category}, with a stable sort preserving the insertion
 * order within each category; {@link #lookup(String, String)} returns the first matching rule.
 * Custom tables are assembled with {@link #builder()}: rules added first take precedence within
 * their category, so that overriding a default rule amounts to adding the custom rule before
 * the default table.
 * </p>
 */
public final class RuleTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleTable.class);

    private static final Rule DEFAULT_FALLBACK = new Rule(Rule.Category.FALLBACK, ":(.+)", null,
            Rule.Action.FALLBACK, "fred:$1", null, false);

    @Nullable
    private static RuleTable defaultTable = null;

    private final List<Rule> rules;

    private RuleTable(final List<Rule> rules) {
        final List<Rule> sorted = Lists.newArrayList(rules);
        Collections.sort(sorted, new Comparator<Rule>() {

            @Override
            public int compare(final Rule first, final Rule second) {
                return first.getCategory().compareTo(second.getCategory());
            }

        });
        this.rules = ImmutableList.copyOf(sorted);
    }

    /**
     * Returns the default table, loaded from the bundled {@code rules.tsv} resource.
     *
     * @return the default table
     */
    public static synchronized RuleTable getDefault() {
        if (defaultTable == null) {
            try {
                defaultTable = load(Tables.resource("rules.tsv"));
            } catch (final IOException ex) {
                throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
            }
        }
        return defaultTable;
    }

    /**
     * Loads a table from a tab-separated resource with columns category, relation, value,
     * action, predicate, object and flags.
     *
     * @param url
     *            the resource URL
     * @return the loaded table
     * @throws IOException
     *             if the resource cannot be read or contains invalid rows
     */
    public static RuleTable load(final URL url) throws IOException {
        final Builder builder = builder();
        for (final List<String> row : Tables.read(url, 4)) {
            try {
                builder.add(Rule.parse(row));
            } catch (final IllegalArgumentException ex) {
                throw new IOException("Invalid rule in " + url + ": " + row, ex);
            }
        }
        final RuleTable table = builder.build();
        LOGGER.debug("Loaded {} rules from {}", table.rules.size(), url);
        return table;
    }

    public List<Rule> getRules() {
        return this.rules;
    }

    /**
     * Returns the first rule matching the relation and value specified. A generic fallback rule
     * is returned if the table has no matching rule.
     *
     * @param relation
     *            the relation, e.g. {@code :prep-at}
     * @param value
     *            the label of the relation value, null if not available
     * @return the matching rule, never null
     */
    public Rule lookup(final String relation, @Nullable final String value) {
        final String normalized = relation.toLowerCase(Locale.ROOT);
        for (final Rule rule : this.rules) {
            if (rule.matches(normalized, value)) {
                return rule;
            }
        }
        return DEFAULT_FALLBACK;
    }

    /**
     * Checks whether the table contains an {@code EXACT} rule for the relation specified,
     * regardless of value constraints.
     *
     * @param relation
     *            the relation
     * @return true if an exact rule exists
     */
    public boolean hasExactRule(final String relation) {
        final String normalized = relation.toLowerCase(Locale.ROOT);
        for (final Rule rule : this.rules) {
            if (rule.getCategory() != Rule.Category.EXACT) {
                break;
            }
            if (rule.getRelation().equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "RuleTable (" + this.rules.size() + " rules)";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<Rule> rules;

        Builder() {
            this.rules = Lists.newArrayList();
        }

        public Builder add(final Rule rule) {
            this.rules.add(rule);
            return this;
        }

        public Builder addAll(final RuleTable table) {
            this.rules.addAll(table.rules);
            return this;
        }

        public RuleTable build() {
            return new RuleTable(this.rules);
        }

    }

}
