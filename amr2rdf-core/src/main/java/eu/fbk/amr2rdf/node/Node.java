package eu.fbk.amr2rdf.node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * An element of an AMR graph.
 * <p>
 * A {@code Node} represents either an AMR concept, introduced by a {@code (var / concept ...)}
 * expression, or a constant leaf (quoted string, number or bare symbol). Each node has a
 * process-unique, monotonic {@link #getId() id}, an optional AMR {@link #getVar() variable}
 * (immutable once bound), a {@link #getRelation() relation} naming the edge from its primary
 * parent (empty for the root), a {@link #getLabel() label} (concept name or literal text), an
 * optional {@link #getVerb() verb sense}, a {@link NodeType classification}, a
 * {@link NodeStatus status} and a few flags used by the translation engine.
 * </p>
 * <p>
 * Nodes own an ordered list of outgoing edges, each made of a relation and a child, whose order
 * is meaningful (e.g., {@code :op1}, {@code :op2}) and preserved by all copy operations. The same
 * child may be reached through several edges of the same parent, as in
 * {@code (s / see-01 :ARG0 (i / i) :ARG1 i)}. A node has at most one <i>primary</i>
 * parent, set the first time it is added as a child, and any number of <i>additional</i>
 * parents, created when a re-entrant AMR variable attaches the same node to further parents.
 * Parent references are lookup-only back-links. Since re-entrancy may introduce cycles through
 * child links, every traversal and copy operation keeps track of visited node ids and never
 * descends twice into the same node.
 * </p>
 * <p>
 * Nodes are not thread safe; a node tree is meant to be built and translated by a single thread
 * and then discarded as a unit. Equality is identity based.
 * </p>
 */
public final class Node {

    private static final AtomicLong ID_COUNTER = new AtomicLong(0L);

    private static final Pattern VERB_PATTERN = Pattern.compile(".+-[0-9]+");

    private final long id;

    @Nullable
    private final String var;

    private String relation;

    private String label;

    @Nullable
    private String verb;

    private NodeType type;

    private NodeStatus status;

    private boolean visible;

    private boolean synthetic;

    private boolean malformed;

    private boolean quoted;

    private final List<Node> children;

    private final List<String> childRelations;

    @Nullable
    private Node parent;

    private final List<Link> links;

    /**
     * Creates a new node with the variable and label specified. The node is classified as
     * {@link NodeType#VERB} if it has a variable and its label ends with a numeric sense suffix
     * (e.g., {@code want-01}), as {@link NodeType#NOUN} if it has only a variable and as
     * {@link NodeType#OTHER} otherwise.
     *
     * @param var
     *            the AMR variable, null for constant leaves
     * @param label
     *            the concept name or literal text, possibly empty
     */
    public Node(@Nullable final String var, final String label) {
        this.id = ID_COUNTER.incrementAndGet();
        this.var = var;
        this.relation = "";
        this.label = Preconditions.checkNotNull(label);
        this.verb = null;
        this.type = classify(var, label);
        this.status = NodeStatus.OK;
        this.visible = true;
        this.synthetic = false;
        this.malformed = false;
        this.quoted = false;
        this.children = Lists.newArrayList();
        this.childRelations = Lists.newArrayList();
        this.parent = null;
        this.links = Lists.newArrayListWithCapacity(1);
    }

    /**
     * Creates a constant leaf node for the literal specified.
     *
     * @param label
     *            the literal text
     * @param quoted
     *            true if the literal was a quoted string in the AMR source
     * @return the created node
     */
    public static Node literal(final String label, final boolean quoted) {
        final Node node = new Node(null, label);
        node.quoted = quoted;
        return node;
    }

    private static NodeType classify(@Nullable final String var, final String label) {
        if (var == null) {
            return NodeType.OTHER;
        }
        return VERB_PATTERN.matcher(label).matches() ? NodeType.VERB : NodeType.NOUN;
    }

    public long getId() {
        return this.id;
    }

    @Nullable
    public String getVar() {
        return this.var;
    }

    /**
     * Returns the relation of the edge from the primary parent, or an empty string for the root.
     *
     * @return the relation, e.g. {@code :arg0}
     */
    public String getRelation() {
        return this.relation;
    }

    /**
     * Returns the relation of the first edge from the parent specified, which may be the primary
     * or an additional parent. Use {@link #getChildRelations()} on the parent to enumerate all
     * its edges.
     *
     * @param parent
     *            the parent node
     * @return the relation of the edge, or null if the node is not a child of the parent
     */
    @Nullable
    public String getRelation(final Node parent) {
        final int index = parent.children.indexOf(this);
        return index < 0 ? null : parent.childRelations.get(index);
    }

    public String getLabel() {
        return this.label;
    }

    public void setLabel(final String label) {
        this.label = Preconditions.checkNotNull(label);
    }

    @Nullable
    public String getVerb() {
        return this.verb;
    }

    public void setVerb(@Nullable final String verb) {
        this.verb = verb;
    }

    public NodeType getType() {
        return this.type;
    }

    public void setType(final NodeType type) {
        this.type = Preconditions.checkNotNull(type);
    }

    public NodeStatus getStatus() {
        return this.status;
    }

    public void setStatus(final NodeStatus status) {
        this.status = Preconditions.checkNotNull(status);
    }

    /**
     * Returns whether triples originating from this node belong to the visible graph.
     *
     * @return true if visible
     */
    public boolean isVisible() {
        return this.visible;
    }

    public void setVisible(final boolean visible) {
        this.visible = visible;
    }

    /**
     * Returns whether this is a synthetic node, created by the parser or the translation engine
     * rather than read from the AMR text.
     *
     * @return true if synthetic
     */
    public boolean isSynthetic() {
        return this.synthetic;
    }

    public void setSynthetic(final boolean synthetic) {
        this.synthetic = synthetic;
    }

    public boolean isMalformed() {
        return this.malformed;
    }

    public void setMalformed(final boolean malformed) {
        this.malformed = malformed;
    }

    /**
     * Returns whether this leaf was a quoted string in the AMR source.
     *
     * @return true if quoted
     */
    public boolean isQuoted() {
        return this.quoted;
    }

    /**
     * Returns whether this node is a constant leaf, i.e., it has no variable.
     *
     * @return true for constants
     */
    public boolean isConstant() {
        return this.var == null;
    }

    /**
     * Returns an unmodifiable view of the ordered children of this node, one element per edge:
     * a child reached through several relations is listed once for each of them.
     *
     * @return the children
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(this.children);
    }

    /**
     * Returns an unmodifiable view of the relations of the outgoing edges of this node, parallel
     * to {@link #getChildren()}.
     *
     * @return the relations, one per edge
     */
    public List<String> getChildRelations() {
        return Collections.unmodifiableList(this.childRelations);
    }

    /**
     * Returns the first direct child reached through the relation specified.
     *
     * @param relation
     *            the relation
     * @return the child, or null if none
     */
    @Nullable
    public Node getChild(final String relation) {
        final int index = this.childRelations.indexOf(relation);
        return index < 0 ? null : this.children.get(index);
    }

    @Nullable
    public Node getParent() {
        return this.parent;
    }

    /**
     * Returns all the distinct parents of this node, starting with the primary one.
     *
     * @return an immutable list of parents, empty for the root
     */
    public List<Node> getParents() {
        final Set<Node> parents = Sets.newLinkedHashSet();
        if (this.parent != null) {
            parents.add(this.parent);
        }
        for (final Link link : this.links) {
            parents.add(link.parent);
        }
        return ImmutableList.copyOf(parents);
    }

    /**
     * Returns whether this node is reached through more than one edge, from distinct parents or
     * from the same parent.
     *
     * @return true for re-entrant nodes
     */
    public boolean isReentrant() {
        return !this.links.isEmpty();
    }

    /**
     * Adds a child using the child's current relation. See {@link #addChild(String, Node)}.
     *
     * @param child
     *            the child to add
     * @return true if the edge was added, false if it already existed
     */
    public boolean addChild(final Node child) {
        return addChild(child.relation, child);
    }

    /**
     * Appends an edge to the child specified, labeled with the relation specified. If the child
     * has no primary parent, this node becomes its primary parent; otherwise (re-entrancy) an
     * additional parent link is created. A node that is already an ancestor of this node along
     * primary parent links is always attached through an additional link, so that primary parent
     * chains never form cycles. The operation is idempotent on the (relation, child) pair: the
     * same child may be added again under a different relation.
     *
     * @param relation
     *            the relation of the new edge
     * @param child
     *            the child to add
     * @return true if the edge was added, false if it already existed
     */
    public boolean addChild(final String relation, final Node child) {
        Preconditions.checkNotNull(relation);
        Preconditions.checkNotNull(child);
        for (int i = 0; i < this.children.size(); ++i) {
            if (this.children.get(i) == child && this.childRelations.get(i).equals(relation)) {
                return false;
            }
        }
        final boolean attached = this.children.contains(child);
        this.children.add(child);
        this.childRelations.add(relation);
        if (!attached && child.parent == null && !child.isPrimaryAncestorOf(this)) {
            child.parent = this;
            child.relation = relation;
        } else {
            child.links.add(new Link(this, relation));
        }
        return true;
    }

    private boolean isPrimaryAncestorOf(final Node node) {
        for (Node n = node; n != null; n = n.parent) {
            if (n == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first node in pre-order, starting from this node, bound to the variable
     * specified.
     *
     * @param var
     *            the variable
     * @return the node, or null if not found
     */
    @Nullable
    public Node findByVariable(final String var) {
        Preconditions.checkNotNull(var);
        return depthFirstSearch((final Node node) -> var.equals(node.var));
    }

    /**
     * Returns the first node in pre-order, starting from this node, matching the predicate
     * specified. Each node is visited at most once, even in presence of cycles.
     *
     * @param predicate
     *            the predicate
     * @return the first matching node, or null if none matches
     */
    @Nullable
    public Node depthFirstSearch(final Predicate<? super Node> predicate) {
        Preconditions.checkNotNull(predicate);
        final Set<Long> visited = Sets.newHashSet();
        final Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            final Node node = stack.pop();
            if (!visited.add(node.id)) {
                continue;
            }
            if (predicate.apply(node)) {
                return node;
            }
            for (int i = node.children.size() - 1; i >= 0; --i) {
                stack.push(node.children.get(i));
            }
        }
        return null;
    }

    /**
     * Returns all the nodes reachable from this node, in deterministic pre-order, each node
     * listed once.
     *
     * @return an immutable list of nodes, starting with this node
     */
    public List<Node> preOrder() {
        final ImmutableList.Builder<Node> builder = ImmutableList.builder();
        depthFirstSearch((final Node node) -> {
            builder.add(node);
            return false;
        });
        return builder.build();
    }

    /**
     * Returns the nearest ancestor (primary or additional parents, breadth first) matching the
     * predicate specified. Each ancestor is visited at most once.
     *
     * @param predicate
     *            the predicate
     * @return the nearest matching ancestor, or null if none
     */
    @Nullable
    public Node getAncestor(final Predicate<? super Node> predicate) {
        final Set<Long> visited = Sets.newHashSet(this.id);
        final Deque<Node> queue = new ArrayDeque<>(getParents());
        while (!queue.isEmpty()) {
            final Node node = queue.removeFirst();
            if (!visited.add(node.id)) {
                continue;
            }
            if (predicate.apply(node)) {
                return node;
            }
            queue.addAll(node.getParents());
        }
        return null;
    }

    /**
     * Returns a copy of this node according to the mode specified. Copies get new ids and no
     * parent; child ordering is preserved. Deep and structure-only copies detect re-entrancy and
     * cycles, copying each reachable node exactly once.
     *
     * @param mode
     *            the copy mode
     * @return the copy
     */
    public Node copy(final CopyMode mode) {
        switch (mode) {
        case SHALLOW:
            return shallowCopy(false);
        case CHILDREN_ONLY:
            final Node copy = shallowCopy(false);
            final Map<Long, Node> childCopies = Maps.newHashMap();
            for (int i = 0; i < this.children.size(); ++i) {
                final Node child = this.children.get(i);
                Node childCopy = childCopies.get(child.id);
                if (childCopy == null) {
                    childCopy = child.shallowCopy(false);
                    childCopies.put(child.id, childCopy);
                }
                copy.addChild(this.childRelations.get(i), childCopy);
            }
            return copy;
        case DEEP:
            return deepCopy(this, Maps.<Long, Node>newHashMap(), false);
        case STRUCTURE_ONLY:
            return deepCopy(this, Maps.<Long, Node>newHashMap(), true);
        default:
            throw new Error("Unexpected copy mode " + mode);
        }
    }

    private Node shallowCopy(final boolean clear) {
        final Node copy = new Node(clear ? null : this.var, clear ? "" : this.label);
        copy.relation = this.relation;
        copy.verb = clear ? null : this.verb;
        copy.type = this.type;
        copy.status = this.status;
        copy.visible = this.visible;
        copy.synthetic = clear || this.synthetic;
        copy.malformed = this.malformed;
        copy.quoted = !clear && this.quoted;
        return copy;
    }

    private static Node deepCopy(final Node node, final Map<Long, Node> copies,
            final boolean clear) {
        final Node copy = node.shallowCopy(clear);
        copies.put(node.id, copy);
        copyChildren(node, copy, copies, clear);
        return copy;
    }

    private static void copyChildren(final Node node, final Node copy,
            final Map<Long, Node> copies, final boolean clear) {
        for (int i = 0; i < node.children.size(); ++i) {
            final Node child = node.children.get(i);
            final String relation = node.childRelations.get(i);
            final Node existing = copies.get(child.id);
            if (existing != null) {
                copy.addChild(relation, existing);
            } else {
                // attach before descending, so that back references see a connected chain
                final Node childCopy = child.shallowCopy(clear);
                copies.put(child.id, childCopy);
                copy.addChild(relation, childCopy);
                copyChildren(child, childCopy, copies, clear);
            }
        }
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append('[').append(this.id).append(']');
        if (!this.relation.isEmpty()) {
            builder.append(' ').append(this.relation);
        }
        builder.append(' ');
        if (this.var != null) {
            builder.append(this.var).append(" / ");
        }
        builder.append(this.quoted ? "\"" + this.label + "\"" : this.label);
        if (this.status != NodeStatus.OK) {
            builder.append(" <").append(this.status).append('>');
        }
        return builder.toString();
    }

    private static final class Link {

        final Node parent;

        final String relation;

        Link(final Node parent, final String relation) {
            this.parent = parent;
            this.relation = relation;
        }

    }

}
