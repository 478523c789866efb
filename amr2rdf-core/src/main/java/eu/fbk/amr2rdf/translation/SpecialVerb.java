package eu.fbk.amr2rdf.translation;

import java.util.List;
import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A verb whose frame encoding is replaced by direct triples between its arguments.
 * <p>
 * For {@link Kind#ROLE} verbs such as {@code have-org-role-91}, the bearer is linked to the role
 * with the bearer predicate and the role to the context with the context predicate. For
 * {@link Kind#REIFY} verbs such as {@code be-located-at-91}, the {@code :arg1} value is linked to
 * the {@code :arg2} value as if they were connected by the reified relation. In both cases the
 * frame triples of the verb and its argument edges are moved to the suppressed graph.
 * </p>
 */
public final class SpecialVerb {

    public enum Kind {

        ROLE,

        REIFY

    }

    private final String verb;

    private final Kind kind;

    private final List<String> arguments;

    @Nullable
    private final String relation;

    @Nullable
    private final String bearerPredicate;

    @Nullable
    private final String contextPredicate;

    private SpecialVerb(final String verb, final Kind kind, final List<String> arguments,
            @Nullable final String relation, @Nullable final String bearerPredicate,
            @Nullable final String contextPredicate) {
        this.verb = Preconditions.checkNotNull(verb);
        this.kind = Preconditions.checkNotNull(kind);
        this.arguments = ImmutableList.copyOf(arguments);
        this.relation = relation;
        this.bearerPredicate = bearerPredicate;
        this.contextPredicate = contextPredicate;
    }

    /**
     * Creates a role verb.
     *
     * @param verb
     *            the verb concept, e.g. {@code have-org-role-91}
     * @param bearerArgument
     *            the relation of the role bearer, e.g. {@code :arg0}
     * @param roleArgument
     *            the relation of the role, e.g. {@code :arg2}
     * @param contextArgument
     *            the relation of the role context, e.g. {@code :arg1}
     * @param bearerPredicate
     *            the predicate linking bearer and role
     * @param contextPredicate
     *            the predicate linking role and context
     * @return the created verb
     */
    public static SpecialVerb role(final String verb, final String bearerArgument,
            final String roleArgument, final String contextArgument,
            final String bearerPredicate, final String contextPredicate) {
        return new SpecialVerb(verb, Kind.ROLE, ImmutableList.of(bearerArgument, roleArgument,
                contextArgument), null, Preconditions.checkNotNull(bearerPredicate),
                Preconditions.checkNotNull(contextPredicate));
    }

    /**
     * Creates a reification verb.
     *
     * @param verb
     *            the verb concept, e.g. {@code be-located-at-91}
     * @param relation
     *            the reified relation, e.g. {@code :location}
     * @return the created verb
     */
    public static SpecialVerb reify(final String verb, final String relation) {
        return new SpecialVerb(verb, Kind.REIFY, ImmutableList.of(":arg1", ":arg2"),
                Preconditions.checkNotNull(relation), null, null);
    }

    static SpecialVerb parse(final List<String> row) {
        final Kind kind = Kind.valueOf(row.get(1).toUpperCase(Locale.ROOT));
        if (kind == Kind.ROLE) {
            Preconditions.checkArgument(row.size() >= 7, "Role verb requires 7 columns: %s", row);
            return role(row.get(0), row.get(2), row.get(3), row.get(4), row.get(5), row.get(6));
        } else {
            return reify(row.get(0), row.get(2));
        }
    }

    public String getVerb() {
        return this.verb;
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the argument relations consumed by the direct encoding: bearer, role and context
     * for role verbs, {@code :arg1} and {@code :arg2} for reification verbs.
     *
     * @return an immutable list of relations
     */
    public List<String> getArguments() {
        return this.arguments;
    }

    @Nullable
    public String getRelation() {
        return this.relation;
    }

    @Nullable
    public String getBearerPredicate() {
        return this.bearerPredicate;
    }

    @Nullable
    public String getContextPredicate() {
        return this.contextPredicate;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("verb", this.verb)
                .add("kind", this.kind).add("arguments", this.arguments)
                .add("relation", this.relation).toString();
    }

}
