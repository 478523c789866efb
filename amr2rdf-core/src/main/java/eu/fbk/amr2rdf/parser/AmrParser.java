package eu.fbk.amr2rdf.parser;

import java.text.Normalizer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.amr2rdf.Configuration;
import eu.fbk.amr2rdf.Diagnostic;
import eu.fbk.amr2rdf.MalformedInputException;
import eu.fbk.amr2rdf.node.Node;
import eu.fbk.amr2rdf.node.NodeStatus;
import eu.fbk.amr2rdf.node.NodeType;

/**
 * Parser of AMR graphs in Penman notation.
 * <p>
 * The parser turns an AMR text into a tree of {@link Node}s. Re-entrant variables (a relation
 * value that is the variable of a concept declared elsewhere in the document, before or after the
 * reference) are resolved to the same {@code Node}, which gets an additional parent. A text
 * containing several top-level graphs is wrapped under a synthetic, invisible
 * {@code multi-sentence} root with ordered {@code :snt1}, {@code :snt2}, ... relations.
 * </p>
 * <p>
 * Parsing is tolerant: malformed relations, unresolved references and subtrees exceeding the
 * configured depth or node budget are recovered by creating nodes with status
 * {@link NodeStatus#ERROR} and recording a {@link Diagnostic}. Only texts that are structurally
 * unrecoverable (no graph, unmatched closing parenthesis, unterminated string) are rejected with a
 * {@link MalformedInputException}. Missing closing parentheses at the end of the text are added.
 * </p>
 * <p>
 * Instances are immutable and can be shared among threads: all the parsing state, including the
 * variable binding table and the budget counters, is scoped to a single call.
 * </p>
 */
public final class AmrParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(AmrParser.class);

    /** Label of the node wrapping the sentences of a multi-sentence document. */
    public static final String MULTI_SENTENCE = "multi-sentence";

    private static final Pattern VERB_PATTERN = Pattern.compile("(.+)-([0-9]+)");

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("[a-z]+[0-9]+");

    private static final Pattern RELATION_PATTERN = Pattern.compile(":[a-z0-9][a-z0-9_.-]*");

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private final int maxDepth;

    private final int maxNodes;

    /**
     * Creates a parser using the depth and node limits of the default {@link Configuration}.
     */
    public AmrParser() {
        this(Configuration.getDefault());
    }

    public AmrParser(final Configuration configuration) {
        this(configuration.getMaxDepth(), configuration.getMaxNodes());
    }

    /**
     * Creates a parser with the limits specified.
     *
     * @param maxDepth
     *            the maximum nesting depth of concepts, the root having depth 1
     * @param maxNodes
     *            the maximum number of nodes created for a document
     */
    public AmrParser(final int maxDepth, final int maxNodes) {
        Preconditions.checkArgument(maxDepth > 0, "Invalid max depth: %s", maxDepth);
        Preconditions.checkArgument(maxNodes > 0, "Invalid max nodes: %s", maxNodes);
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    /**
     * Parses the AMR text specified, returning the root node.
     *
     * @param text
     *            the AMR text
     * @return the root node
     * @throws MalformedInputException
     *             if the text is structurally unrecoverable
     */
    public Node parse(final String text) {
        return parseDocument(text).getRoot();
    }

    /**
     * Parses the AMR text specified, returning the root node together with variable bindings
     * and diagnostics.
     *
     * @param text
     *            the AMR text
     * @return the parsed document
     * @throws MalformedInputException
     *             if the text is structurally unrecoverable
     */
    public AmrDocument parseDocument(final String text) {
        Preconditions.checkNotNull(text);
        final String normalized = normalize(text);
        if (normalized.isEmpty()) {
            throw new MalformedInputException(text, -1, "Empty AMR text");
        }
        final Session session = new Session(normalized, Tokenizer.tokenize(normalized),
                new ParseBudget(this.maxDepth, this.maxNodes));
        final AmrDocument document = session.run();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parsed {} nodes, {} variables, {} diagnostics",
                    session.budget.getNodes(), document.getBindings().size(),
                    document.getDiagnostics().size());
        }
        return document;
    }

    /**
     * Normalizes an AMR text: metadata lines starting with {@code #} are dropped, line breaks and
     * tabs are turned into spaces, encoded and typographic quotes are replaced with plain ones,
     * diacritics are removed and whitespace is collapsed.
     *
     * @param text
     *            the text to normalize
     * @return the normalized text
     */
    public static String normalize(final String text) {
        final StringBuilder builder = new StringBuilder(text.length());
        for (final String line : Splitter.onPattern("\r?\n|\r").split(text)) {
            if (!line.trim().startsWith("#")) {
                builder.append(line).append(' ');
            }
        }
        String result = builder.toString().replace("\\\"", "\"").replace("&quot;", "\"")
                .replace('“', '"').replace('”', '"').replace('‘', '\'')
                .replace('’', '\'');
        result = DIACRITICS.matcher(Normalizer.normalize(result, Normalizer.Form.NFD))
                .replaceAll("");
        return CharMatcher.whitespace().trimAndCollapseFrom(result, ' ');
    }

    private static final class Session {

        private final String text;

        private final List<Token> tokens;

        private final ParseBudget budget;

        private final Map<String, Node> bindings;

        private final Set<String> declared;

        private final Set<String> pending;

        private final List<Diagnostic> diagnostics;

        private int pos;

        Session(final String text, final List<Token> tokens, final ParseBudget budget) {
            this.text = text;
            this.budget = budget;
            this.bindings = Maps.newLinkedHashMap();
            this.declared = Sets.newHashSet();
            this.pending = Sets.newLinkedHashSet();
            this.diagnostics = Lists.newArrayList();
            this.tokens = checkParentheses(text, tokens);
            this.pos = 0;
        }

        private List<Token> checkParentheses(final String text, final List<Token> tokens) {
            int depth = 0;
            boolean found = false;
            for (final Token token : tokens) {
                if (token.is(Token.Type.OPEN)) {
                    ++depth;
                    found = true;
                } else if (token.is(Token.Type.CLOSE) && --depth < 0) {
                    throw new MalformedInputException(text, token.getOffset(),
                            "Unmatched closing parenthesis");
                }
            }
            if (!found) {
                throw new MalformedInputException(text, -1, "No AMR graph found");
            }
            if (depth == 0) {
                return tokens;
            }
            diagnose(Diagnostic.Kind.MALFORMED_NODE, 0L, null, "Added " + depth
                    + " missing closing parenthes(es) at end of text");
            final List<Token> repaired = Lists.newArrayList(tokens);
            for (int i = 0; i < depth; ++i) {
                repaired.add(new Token(Token.Type.CLOSE, ")", text.length()));
            }
            return repaired;
        }

        AmrDocument run() {
            // Collect declared variables, so that forward references can be recognized
            for (int i = 0; i + 2 < this.tokens.size(); ++i) {
                if (this.tokens.get(i).is(Token.Type.OPEN)
                        && this.tokens.get(i + 1).is(Token.Type.SYMBOL)
                        && this.tokens.get(i + 2).is(Token.Type.SLASH)) {
                    this.declared.add(this.tokens.get(i + 1).getText());
                }
            }

            // Parse top level graphs, ignoring anything in between
            final List<Node> roots = Lists.newArrayList();
            while (this.pos < this.tokens.size()) {
                final Token token = this.tokens.get(this.pos);
                if (token.is(Token.Type.OPEN)) {
                    roots.add(parseConcept(null, "", 1));
                } else {
                    diagnose(Diagnostic.Kind.MALFORMED_NODE, 0L, null, "Ignored token '"
                            + token + "' at offset " + token.getOffset());
                    ++this.pos;
                }
            }

            // Wrap multiple sentences under a synthetic root
            final Node root;
            if (roots.size() == 1) {
                root = roots.get(0);
                if (MULTI_SENTENCE.equals(root.getLabel())) {
                    root.setVisible(false);
                }
            } else {
                root = new Node(null, MULTI_SENTENCE);
                root.setSynthetic(true);
                root.setVisible(false);
                for (int i = 0; i < roots.size(); ++i) {
                    root.addChild(":snt" + (i + 1), roots.get(i));
                }
            }

            // Forward references whose declaration was pruned or malformed
            for (final String var : this.pending) {
                final Node node = this.bindings.get(var);
                node.setStatus(NodeStatus.ERROR);
                diagnose(Diagnostic.Kind.UNRESOLVED_REFERENCE, node.getId(),
                        node.getRelation(), "Variable '" + var + "' is never declared");
            }

            return new AmrDocument(this.text, root, this.bindings, this.diagnostics);
        }

        private Node parseConcept(@Nullable final Node parent, final String relation,
                final int depth) {

            final Token open = next();
            if (!this.budget.allowsDepth(depth) || !this.budget.allowsNode()) {
                final Node node = new Node(null, "");
                node.setStatus(NodeStatus.ERROR);
                node.setMalformed(true);
                attach(parent, relation, node);
                diagnose(Diagnostic.Kind.BUDGET_EXCEEDED, node.getId(), relation,
                        "Subtree at offset " + open.getOffset() + " pruned (" + this.budget
                                + ", depth " + depth + ")");
                skipGroup();
                return node;
            }

            final Node node;
            final Token first = peek();
            if (first.is(Token.Type.SYMBOL)) {
                ++this.pos;
                final String var = first.getText();
                String concept = var;
                boolean malformed = true;
                if (peek().is(Token.Type.SLASH)) {
                    ++this.pos;
                    final Token value = peek();
                    if (value.is(Token.Type.SYMBOL) || value.is(Token.Type.STRING)) {
                        ++this.pos;
                        concept = value.getText();
                        malformed = false;
                    }
                }
                node = bind(var, concept, parent, relation);
                if (malformed) {
                    node.setMalformed(true);
                    diagnose(Diagnostic.Kind.MALFORMED_NODE, node.getId(), relation,
                            "Missing concept for variable '" + var + "'");
                }
            } else {
                node = new Node(null, "");
                node.setStatus(NodeStatus.ERROR);
                node.setMalformed(true);
                attach(parent, relation, node);
                diagnose(Diagnostic.Kind.MALFORMED_NODE, node.getId(), relation,
                        "Missing variable at offset " + open.getOffset());
            }

            while (!peek().is(Token.Type.CLOSE)) {
                final Token token = next();
                if (token.is(Token.Type.ROLE)) {
                    parseValue(node, token.getText(), depth);
                } else {
                    node.setMalformed(true);
                    diagnose(Diagnostic.Kind.MALFORMED_NODE, node.getId(), null,
                            "Unexpected token '" + token + "' at offset " + token.getOffset());
                    if (token.is(Token.Type.OPEN)) {
                        skipGroup();
                    }
                }
            }
            next();
            return node;
        }

        private void parseValue(final Node node, final String relation, final int depth) {
            final boolean valid = RELATION_PATTERN.matcher(relation).matches();
            final Token token = peek();
            final Node child;
            if (token.is(Token.Type.OPEN)) {
                child = parseConcept(node, relation, depth + 1);

            } else if (token.is(Token.Type.STRING)) {
                ++this.pos;
                child = Node.literal(token.getText(), true);
                attach(node, relation, child);

            } else if (token.is(Token.Type.SYMBOL)) {
                ++this.pos;
                if (valid) {
                    child = resolve(node, relation, token.getText());
                } else {
                    child = Node.literal(token.getText(), false);
                    attach(node, relation, child);
                }

            } else {
                if (token.is(Token.Type.SLASH)) {
                    ++this.pos;
                }
                child = Node.literal("", false);
                child.setStatus(NodeStatus.ERROR);
                child.setMalformed(true);
                attach(node, relation, child);
                diagnose(Diagnostic.Kind.MALFORMED_NODE, child.getId(), relation,
                        "Missing value for relation at offset " + token.getOffset());
            }

            if (!valid && child.getStatus() != NodeStatus.ERROR) {
                child.setStatus(NodeStatus.ERROR);
                child.setMalformed(true);
                diagnose(Diagnostic.Kind.MALFORMED_NODE, child.getId(), relation,
                        "Malformed relation '" + relation + "'");
            }
        }

        private Node resolve(final Node parent, final String relation, final String symbol) {

            // Re-entrancy: backward or forward reference to a declared variable
            if (this.declared.contains(symbol)) {
                Node target = this.bindings.get(symbol);
                if (target == null) {
                    target = new Node(symbol, "");
                    this.bindings.put(symbol, target);
                    this.pending.add(symbol);
                    this.budget.allocate();
                }
                parent.addChild(relation, target);
                return target;
            }

            final Node leaf = Node.literal(symbol, false);
            attach(parent, relation, leaf);
            if (VARIABLE_PATTERN.matcher(symbol).matches()) {
                leaf.setStatus(NodeStatus.ERROR);
                diagnose(Diagnostic.Kind.UNRESOLVED_REFERENCE, leaf.getId(), relation,
                        "Reference to undeclared variable '" + symbol + "'");
            }
            return leaf;
        }

        private Node bind(final String var, final String concept, @Nullable final Node parent,
                final String relation) {
            Node node = this.bindings.get(var);
            if (node != null && this.pending.remove(var)) {
                node.setLabel(concept);
                classify(node);
                attach(parent, relation, node);
            } else if (node != null) {
                node = new Node(null, concept);
                node.setStatus(NodeStatus.ERROR);
                node.setMalformed(true);
                attach(parent, relation, node);
                diagnose(Diagnostic.Kind.MALFORMED_NODE, node.getId(), relation,
                        "Duplicate declaration of variable '" + var + "'");
            } else {
                node = new Node(var, concept);
                classify(node);
                this.bindings.put(var, node);
                this.budget.allocate();
                attach(parent, relation, node);
            }
            return node;
        }

        private void attach(@Nullable final Node parent, final String relation,
                final Node node) {
            if (node.isConstant()) {
                this.budget.allocate();
            }
            if (parent != null) {
                parent.addChild(relation, node);
            }
        }

        private void skipGroup() {
            int depth = 1;
            while (depth > 0) {
                final Token token = next();
                if (token.is(Token.Type.OPEN)) {
                    ++depth;
                } else if (token.is(Token.Type.CLOSE)) {
                    --depth;
                }
            }
        }

        private Token peek() {
            return this.tokens.get(this.pos);
        }

        private Token next() {
            return this.tokens.get(this.pos++);
        }

        private void diagnose(final Diagnostic.Kind kind, final long nodeId,
                @Nullable final String relation, final String message) {
            final Diagnostic diagnostic = new Diagnostic(kind, nodeId, relation, message);
            this.diagnostics.add(diagnostic);
            LOGGER.debug("Recovered: {}", diagnostic);
        }

    }

    /**
     * Sets the classification and verb sense of a concept node from its label: labels with a
     * numeric sense suffix denote verbs (e.g., {@code want-01} has sense {@code want.01}).
     *
     * @param node
     *            the node to classify
     */
    static void classify(final Node node) {
        if (node.isConstant()) {
            node.setType(NodeType.OTHER);
            return;
        }
        final Matcher matcher = VERB_PATTERN.matcher(node.getLabel());
        if (matcher.matches()) {
            node.setType(NodeType.VERB);
            node.setVerb(matcher.group(1) + "." + matcher.group(2));
        } else {
            node.setType(NodeType.NOUN);
            node.setVerb(null);
        }
    }

    @Override
    public String toString() {
        return "AmrParser (max depth " + this.maxDepth + ", max nodes " + this.maxNodes + ")";
    }

}
