package eu.fbk.amr2rdf.translation;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import eu.fbk.amr2rdf.Configuration;
import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.internal.Logging;
import eu.fbk.amr2rdf.node.Node;
import eu.fbk.amr2rdf.node.NodeStatus;
import eu.fbk.amr2rdf.node.NodeType;
import eu.fbk.amr2rdf.parser.AmrDocument;
import eu.fbk.amr2rdf.parser.AmrParser;
import eu.fbk.amr2rdf.rdf.Names;
import eu.fbk.amr2rdf.rdf.RdfWriter;
import eu.fbk.amr2rdf.vocabulary.DUL;
import eu.fbk.amr2rdf.vocabulary.FRED;
import eu.fbk.amr2rdf.vocabulary.FSCHEMA;
import eu.fbk.amr2rdf.vocabulary.QUANT;

/**
 * Translator of AMR node trees into FRED-style RDF graphs.
 * <p>
 * Translation proceeds in two passes over the tree, both visiting each node once in pre-order.
 * The <i>annotation</i> pass classifies nodes: heads of {@code :domain} edges and adjective or
 * demonstrative modifiers become {@link NodeType#FRED} nodes rendered as classes, {@code :name}
 * subtrees become invisible, the first other {@code :mod} of a noun is combined with it into a
 * composite class (e.g. {@code StoneHouse}), a {@code :mod} with {@code :degree} and
 * {@code :compared-to} is merged into its head, and special verbs (see {@link SpecialVerb}) are
 * marked with status
 * {@link NodeStatus#AMR}, grafting a synthetic role node where the role argument is missing. The
 * <i>emission</i> pass mints a URI or literal for each node, emits its type triples and maps each
 * edge to a triple through the {@link RuleTable}; relations ending in {@code -of} without an
 * exact rule are inverted. Triples involving invisible nodes, hidden rules or special verb
 * scaffolding are routed to the suppressed graph.
 * </p>
 * <p>
 * Instances are immutable and thread safe; each translation uses its own
 * {@link TranslationContext}.
 * </p>
 */
public final class Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Translator.class);

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private static final String INVERSE_SUFFIX = "-of";

    private final Configuration configuration;

    private final Glossary glossary;

    private final RuleTable rules;

    private final PropBank propBank;

    private final Names names;

    public Translator() {
        this(Configuration.getDefault(), RuleTable.getDefault());
    }

    public Translator(final Configuration configuration, final RuleTable rules) {
        this(configuration, Glossary.getDefault(), rules, PropBank.getDefault());
    }

    public Translator(final Configuration configuration, final Glossary glossary,
            final RuleTable rules, final PropBank propBank) {
        this.configuration = Preconditions.checkNotNull(configuration);
        this.glossary = Preconditions.checkNotNull(glossary);
        this.rules = Preconditions.checkNotNull(rules);
        this.propBank = Preconditions.checkNotNull(propBank);
        this.names = new Names(glossary.getNamespaces(), configuration.getNamespace());
    }

    public Names getNames() {
        return this.names;
    }

    public RuleTable getRules() {
        return this.rules;
    }

    /**
     * Translates a parsed document, carrying over its parse diagnostics.
     *
     * @param document
     *            the parsed document
     * @return the translation
     */
    public Translation translate(final AmrDocument document) {
        return translate(document.getRoot(), document.getDiagnostics());
    }

    /**
     * Translates the node tree rooted at the node specified. The tree is annotated in place.
     *
     * @param root
     *            the root node
     * @return the translation
     */
    public Translation translate(final Node root) {
        return translate(root, ImmutableList.<Diagnostic>of());
    }

    private Translation translate(final Node root, final List<Diagnostic> diagnostics) {

        Preconditions.checkNotNull(root);

        final Map<String, String> mdc = Logging.getMDC();
        try {
            MDC.put(Logging.MDC_CONTEXT, "amr" + root.getId());

            final long ts = System.currentTimeMillis();
            final TranslationContext context = new TranslationContext(root, new RdfWriter(
                    this.names.getNamespaces()), diagnostics);

            annotate(context);
            emit(context);
            emitTopic(context);
            declareProperties(context);

            final Translation translation = new Translation(root, context.getWriter(),
                    context.getDiagnostics());
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Translated in {} ms: {} visible, {} suppressed triples, "
                        + "{} diagnostics", System.currentTimeMillis() - ts, translation
                        .getGraph().size(), translation.getSuppressedGraph().size(),
                        translation.getDiagnostics().size());
            }
            return translation;

        } finally {
            Logging.setMDC(mdc);
        }
    }

    // ANNOTATION PASS

    private void annotate(final TranslationContext context) {
        for (final Node node : context.getRoot().preOrder()) {
            if (!isTranslatable(node) || isSentenceWrapper(node)) {
                continue;
            }
            final List<Node> children = ImmutableList.copyOf(node.getChildren());
            final List<String> relations = ImmutableList.copyOf(node.getChildRelations());
            for (int i = 0; i < children.size(); ++i) {
                final Node child = children.get(i);
                final String relation = relations.get(i);
                if (":name".equals(relation) && !child.isConstant()
                        && "name".equals(child.getLabel())) {
                    child.setVisible(false);
                } else if (":domain".equals(relation) && node.getType() == NodeType.NOUN) {
                    node.setType(NodeType.FRED);
                } else if (":mod".equals(relation) && child.getType() == NodeType.NOUN
                        && child.getChildren().isEmpty() && !child.isReentrant()
                        && (this.glossary.isAdjective(child.getLabel()) || this.glossary
                                .isDemonstrative(child.getLabel()))) {
                    child.setType(NodeType.FRED);
                }
            }
            annotateModifiers(context, node, children, relations);
            final SpecialVerb verb = this.glossary.getSpecialVerb(node.getLabel());
            if (verb != null && node.getType() == NodeType.VERB) {
                node.setStatus(NodeStatus.AMR);
                if (verb.getKind() == SpecialVerb.Kind.ROLE) {
                    final String roleArgument = verb.getArguments().get(1);
                    if (node.getChild(roleArgument) == null) {
                        final Node role = new Node(node.getVar() + "_role", "role");
                        role.setSynthetic(true);
                        node.addChild(roleArgument, role);
                        LOGGER.debug("Grafted missing {} of {}", roleArgument, node);
                    }
                }
            }
        }
    }

    private void annotateModifiers(final TranslationContext context, final Node node,
            final List<Node> children, final List<String> relations) {

        if (node.getType() != NodeType.NOUN && node.getType() != NodeType.FRED
                || node.getType() == NodeType.FRED && node.getChild(":domain") == null
                || node.getStatus() != NodeStatus.OK) {
            return;
        }

        boolean composite = false;
        for (int i = 0; i < children.size(); ++i) {
            final Node mod = children.get(i);
            if (!":mod".equals(relations.get(i)) || mod.isConstant() || !isTranslatable(mod)
                    || mod.isReentrant()) {
                continue;
            }

            // :mod + :degree + :compared-to merge into a single comparative concept
            if (mod.getChild(":degree") != null && mod.getChild(":compared-to") != null) {
                node.setLabel(mod.getLabel() + Names.capitalize(node.getLabel()));
                final List<Node> modChildren = ImmutableList.copyOf(mod.getChildren());
                final List<String> modRelations = ImmutableList.copyOf(mod.getChildRelations());
                for (int j = 0; j < modChildren.size(); ++j) {
                    node.addChild(modRelations.get(j), modChildren.get(j));
                }
                mod.setStatus(NodeStatus.REMOVE);
                LOGGER.debug("Merged comparative {} into {}", mod, node);

            } else if (!composite && mod.getType() == NodeType.NOUN
                    && mod.getChild(":name") == null
                    && !this.glossary.isConjunction(mod.getLabel())) {
                mod.setType(NodeType.FRED);
                context.setModifier(node, mod);
                composite = true;
                LOGGER.debug("Composite class for {} modified by {}", node, mod);
            }
        }
    }

    // EMISSION PASS

    private void emit(final TranslationContext context) {
        for (final Node node : context.getRoot().preOrder()) {
            if (node.isConstant() || !isTranslatable(node) || isSentenceWrapper(node)) {
                continue;
            }
            emitTypes(context, node);
            final SpecialVerb verb = node.getStatus() == NodeStatus.AMR ? this.glossary
                    .getSpecialVerb(node.getLabel()) : null;
            final List<Node> children = node.getChildren();
            final List<String> relations = node.getChildRelations();
            for (int i = 0; i < children.size(); ++i) {
                final Node child = children.get(i);
                if (!isTranslatable(child)) {
                    continue;
                }
                final String relation = relations.get(i);
                final boolean scaffold = verb != null && verb.getArguments().contains(relation);
                emitEdge(context, node, relation, child, scaffold);
            }
            if (verb != null) {
                emitSpecialVerb(context, node, verb);
            }
        }
    }

    private void emitTypes(final TranslationContext context, final Node node) {

        final Resource subject = (Resource) mint(context, node);
        final boolean visible = node.isVisible() && node.getStatus() != NodeStatus.AMR;
        final String label = node.getLabel();

        final Node modifier = context.getModifier(node);

        if (node.getType() == NodeType.FRED && modifier != null) {
            final URI headClass = this.names.fredClass(label);
            context.emit(subject, RDFS.SUBCLASSOF, headClass, visible);
            context.emit(subject, DUL.ASSOCIATED_WITH, mint(context, modifier), visible);
            emitSuperClass(context, headClass, label, visible);

        } else if (node.getType() == NodeType.FRED) {
            emitSuperClass(context, (URI) subject, label, visible);

        } else if (node.getType() == NodeType.VERB) {
            final URI frameClass = this.names.resolve("pbrs:" + label);
            context.emit(subject, RDF.TYPE, frameClass, visible);
            context.emit(frameClass, RDFS.SUBCLASSOF, DUL.EVENT, visible);
            final PropBank.Frame frame = this.propBank.getFrame(label);
            if (frame != null) {
                context.emit(frameClass, RDFS.LABEL, Names.literal(frame.getLabel(), true),
                        visible);
                for (final String mapped : frame.getMappedFrames()) {
                    context.emit(frameClass, FSCHEMA.SUBSUMED_UNDER,
                            this.names.resolve(mapped), false);
                }
            } else {
                context.diagnose(Diagnostic.Kind.UNMAPPED_CONSTRUCT, node, null,
                        "Unknown PropBank roleset " + label);
            }

        } else {
            final Glossary.WordCategory category = this.glossary.getWordCategory(label);
            final String concept = category == null || !category.isPronoun() ? label
                    : category == Glossary.WordCategory.THING ? "thing" : "person";
            final Glossary.EntityType type = this.glossary.getEntityType(concept);
            if (modifier != null) {
                final URI compositeClass = this.names.fredClass(modifier.getLabel()
                        + Names.capitalize(concept));
                final URI headClass = type != null && type.isDirect() ? this.names
                        .resolve(type.getTypeName()) : this.names.fredClass(concept);
                context.emit(subject, RDF.TYPE, compositeClass, visible);
                context.emit(compositeClass, RDFS.SUBCLASSOF, headClass, visible);
                context.emit(compositeClass, DUL.ASSOCIATED_WITH, mint(context, modifier),
                        visible);
                emitSuperClass(context, headClass, concept, visible);
            } else if (type != null && type.isDirect()) {
                context.emit(subject, RDF.TYPE, this.names.resolve(type.getTypeName()),
                        visible);
            } else {
                final URI fredClass = this.names.fredClass(concept);
                context.emit(subject, RDF.TYPE, fredClass, visible);
                emitSuperClass(context, fredClass, concept, visible);
            }
            if (category == Glossary.WordCategory.MALE) {
                context.emit(subject, DUL.HAS_QUALITY, this.names.fred(FRED.MALE.getLocalName()),
                        visible);
            } else if (category == Glossary.WordCategory.FEMALE) {
                context.emit(subject, DUL.HAS_QUALITY,
                        this.names.fred(FRED.FEMALE.getLocalName()), visible);
            }
            final String name = getEntityName(node);
            if (name != null) {
                context.emit(subject, RDFS.LABEL, Names.literal(name, true), visible);
            }
        }
    }

    private void emitSuperClass(final TranslationContext context, final URI fredClass,
            final String concept, final boolean visible) {
        final Glossary.EntityType type = this.glossary.getEntityType(concept);
        if (type != null && !type.isDirect()) {
            context.emit(fredClass, RDFS.SUBCLASSOF, this.names.resolve(type.getTypeName()),
                    visible);
        }
    }

    private void emitEdge(final TranslationContext context, final Node parent,
            final String parentRelation, final Node child, final boolean scaffold) {

        // Invert -of relations, unless mapped explicitly or pointing to a constant
        Node subjectNode = parent;
        Node objectNode = child;
        String relation = parentRelation;
        if (relation.endsWith(INVERSE_SUFFIX) && !this.rules.hasExactRule(relation)
                && relation.length() > INVERSE_SUFFIX.length() + 1 && !child.isConstant()) {
            relation = relation.substring(0, relation.length() - INVERSE_SUFFIX.length());
            subjectNode = child;
            objectNode = parent;
        }

        final Rule rule = this.rules.lookup(relation, objectNode.getLabel());
        final boolean visible = !scaffold && !rule.isHidden() && subjectNode.isVisible()
                && objectNode.isVisible();
        final Resource subject = (Resource) mint(context, subjectNode);

        switch (rule.getAction()) {
        case SKIP:
        case NAME:
            break;

        case PROPERTY:
            context.emit(subject, predicate(rule, relation), rule.getObject() != null
                    ? this.names.resolve(rule.getObject()) : mint(context, objectNode), visible);
            break;

        case DOMAIN:
            if (subjectNode.getType() == NodeType.FRED && !objectNode.isConstant()) {
                final Resource entity = (Resource) mint(context, objectNode);
                final Value head = mint(context, subjectNode);
                if (this.glossary.isAdjective(subjectNode.getLabel())) {
                    context.emit(entity, DUL.HAS_QUALITY, head, visible);
                } else {
                    context.emit(entity, RDF.TYPE, head, visible);
                }
            } else {
                context.emit(subject, predicate(rule, relation), mint(context, objectNode),
                        visible);
            }
            break;

        case WIKI:
            final String page = objectNode.getLabel().trim();
            if (!page.isEmpty() && !"-".equals(page)) {
                final String prefix = page.matches("Q[0-9]+") ? "wikidata:" : "dbr:";
                context.emit(subject, OWL.SAMEAS, this.names.resolve(prefix + page), visible);
            }
            break;

        case QUANTITY:
            if (objectNode.isConstant() && Names.isNumber(objectNode.getLabel())
                    && isQuantity(subjectNode)) {
                context.emit(subject, DUL.HAS_DATA_VALUE, mint(context, objectNode), visible);
            } else {
                context.emit(subject, predicate(rule, relation), mint(context, objectNode),
                        visible);
            }
            break;

        case ARGUMENT:
            context.emit(subject, argumentPredicate(context, subjectNode, rule, relation),
                    mint(context, objectNode), visible);
            break;

        case OPERATOR:
            final URI operator;
            if (this.glossary.isConjunction(subjectNode.getLabel())) {
                operator = DUL.HAS_MEMBER;
            } else if (objectNode.isConstant() && Names.isNumber(objectNode.getLabel())) {
                operator = DUL.HAS_DATA_VALUE;
            } else {
                operator = predicate(rule, relation);
            }
            context.emit(subject, operator, mint(context, objectNode), visible);
            break;

        case PREPOSITION:
            context.emit(subject, predicate(rule, relation), mint(context, objectNode), visible);
            break;

        case MODIFIER:
            if (context.getModifier(subjectNode) == objectNode) {
                break;
            }
            final URI modifier;
            if (objectNode.getType() != NodeType.FRED) {
                modifier = predicate(rule, relation);
            } else if (this.glossary.isDemonstrative(objectNode.getLabel())) {
                modifier = QUANT.HAS_DETERMINER;
            } else {
                modifier = DUL.HAS_QUALITY;
            }
            context.emit(subject, modifier, mint(context, objectNode), visible);
            break;

        case FALLBACK:
        default:
            final URI property = predicate(rule, relation);
            context.emit(subject, property, mint(context, objectNode), visible);
            if (!rule.isHidden()) {
                context.diagnose(Diagnostic.Kind.UNMAPPED_CONSTRUCT, child, parentRelation,
                        "No specific rule for relation " + relation + ", mapped to " + property);
            }
            break;
        }
    }

    private URI argumentPredicate(final TranslationContext context, final Node verb,
            final Rule rule, final String relation) {
        if (verb.getType() == NodeType.VERB) {
            final int argument = Integer.parseInt(DIGITS.retainFrom(relation));
            final PropBank.Role role = this.propBank.getRole(verb.getLabel(), argument);
            if (role != null) {
                final URI localRole = this.names.resolve(role.getLocalRole());
                if (role.getGenericRole() != null) {
                    context.emit(localRole, RDFS.SUBPROPERTYOF,
                            this.names.resolve(role.getGenericRole()), false);
                }
                if (role.getThematicRole() != null) {
                    context.emit(localRole, FSCHEMA.SUBSUMED_UNDER,
                            this.names.resolve(role.getThematicRole()), false);
                }
                return localRole;
            }
        }
        return predicate(rule, relation);
    }

    private void emitSpecialVerb(final TranslationContext context, final Node node,
            final SpecialVerb verb) {
        final List<String> arguments = verb.getArguments();
        if (verb.getKind() == SpecialVerb.Kind.ROLE) {
            final Node bearer = translatableChild(node, arguments.get(0));
            final Node role = translatableChild(node, arguments.get(1));
            final Node scope = translatableChild(node, arguments.get(2));
            if (bearer != null && role != null && !bearer.isConstant()) {
                context.emit((Resource) mint(context, bearer),
                        this.names.resolve(verb.getBearerPredicate()), mint(context, role),
                        true);
            }
            if (role != null && scope != null && !role.isConstant()) {
                context.emit((Resource) mint(context, role),
                        this.names.resolve(verb.getContextPredicate()), mint(context, scope),
                        true);
            }
        } else {
            final Node first = translatableChild(node, arguments.get(0));
            final Node second = translatableChild(node, arguments.get(1));
            if (first != null && second != null && !first.isConstant()) {
                emitEdge(context, first, verb.getRelation(), second, false);
            } else {
                context.diagnose(Diagnostic.Kind.MALFORMED_NODE, node, null, "Cannot encode "
                        + node.getLabel() + ": missing or constant arguments");
            }
        }
    }

    private void emitTopic(final TranslationContext context) {
        final Node root = context.getRoot();
        if (!this.configuration.isTopicEnabled()) {
            return;
        }
        for (final Node node : root.preOrder()) {
            if (node.getType() == NodeType.VERB && isTranslatable(node)) {
                return;
            }
            if (node.getChildRelations().contains(":domain")) {
                return;
            }
        }
        final List<Node> sentences = isSentenceWrapper(root) ? root.getChildren()
                : ImmutableList.of(root);
        for (final Node sentence : sentences) {
            if (!sentence.isConstant() && isTranslatable(sentence) && sentence.isVisible()) {
                final Value value = mint(context, sentence);
                context.emit((Resource) value, DUL.HAS_QUALITY,
                        this.names.fred(FRED.TOPIC.getLocalName()), true);
            }
        }
    }

    private void declareProperties(final TranslationContext context) {
        for (final Map.Entry<URI, Boolean> entry : Lists.newArrayList(context.getPredicates()
                .entrySet())) {
            final String ns = entry.getKey().getNamespace();
            if (!ns.equals(RDF.NAMESPACE) && !ns.equals(RDFS.NAMESPACE)
                    && !ns.equals(OWL.NAMESPACE)) {
                context.emit(entry.getKey(), RDF.TYPE, entry.getValue() ? OWL.OBJECTPROPERTY
                        : OWL.DATATYPEPROPERTY, false);
            }
        }
    }

    // MINTING

    private Value mint(final TranslationContext context, final Node node) {

        Value value = context.getValue(node);
        if (value != null) {
            return value;
        }

        final String label = node.getLabel().isEmpty() ? node.getVar() : node.getLabel();
        if (node.isConstant()) {
            value = Names.literal(node.getLabel(), node.isQuoted());
        } else if (node.getType() == NodeType.FRED) {
            final Node modifier = context.getModifier(node);
            value = this.names.fredClass(modifier == null ? label : modifier.getLabel()
                    + Names.capitalize(label));
        } else {
            final String name = getEntityName(node);
            final Glossary.WordCategory category = this.glossary.getWordCategory(label);
            if (name != null) {
                value = this.names.fred(name);
            } else if (node.getType() == NodeType.VERB) {
                final String lemma = node.getVerb() != null ? node.getVerb().substring(0,
                        node.getVerb().lastIndexOf('.')) : label;
                value = this.names.fred(context.occurrence(lemma));
            } else if (category != null && category.isPronoun()) {
                final String word = category == Glossary.WordCategory.THING ? "thing"
                        : "person";
                value = this.names.fred(context.occurrence(word));
            } else {
                value = this.names.fred(context.occurrence(label));
            }
        }

        context.setValue(node, value);
        return value;
    }

    @Nullable
    private String getEntityName(final Node node) {
        final Node name = node.getChild(":name");
        if (name == null || name.isConstant() || !"name".equals(name.getLabel())
                || !isTranslatable(name)) {
            return null;
        }
        final List<String> parts = Lists.newArrayList();
        final List<Node> children = name.getChildren();
        for (int i = 0; i < children.size(); ++i) {
            final Node part = children.get(i);
            if (part.isConstant() && name.getChildRelations().get(i).startsWith(":op")) {
                parts.add(part.getLabel());
            }
        }
        return parts.isEmpty() ? null : Joiner.on(' ').join(parts);
    }

    private URI predicate(final Rule rule, final String relation) {
        final String predicate = rule.expandPredicate(relation);
        return predicate != null ? this.names.resolve(predicate) : this.names.fred(relation
                .substring(1));
    }

    @Nullable
    private static Node translatableChild(final Node node, final String relation) {
        final Node child = node.getChild(relation);
        return child != null && isTranslatable(child) ? child : null;
    }

    private static boolean isQuantity(final Node node) {
        final String label = node.getLabel();
        if (label.endsWith("-quantity")) {
            return true;
        }
        return node.getAncestor((final Node n) -> n.getLabel().endsWith("-quantity")) != null;
    }

    private static boolean isTranslatable(final Node node) {
        return node.getStatus() != NodeStatus.ERROR && node.getStatus() != NodeStatus.REMOVE;
    }

    private static boolean isSentenceWrapper(final Node node) {
        return !node.isVisible() && AmrParser.MULTI_SENTENCE.equals(node.getLabel());
    }

    @Override
    public String toString() {
        return "Translator (" + this.rules + ", namespace " + this.configuration.getNamespace()
                + ")";
    }

}
