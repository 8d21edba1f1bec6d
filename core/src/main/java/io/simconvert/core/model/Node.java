package io.simconvert.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A tagged, attributed, ordered tree element with an optional text payload. The unit of the
 * simulation document model.
 *
 * <p>
 * Attributes keep insertion order and unique keys. Children keep insertion order; that order is
 * significant (series axes, report variables) and is never changed by the node itself. A node
 * normally holds either children or text, but the model does not forbid both.
 *
 * <p>
 * Equality is structural: tag, attributes (including order), text, CDATA flag and children,
 * recursively. The parent link is not part of equality. Copying, equality and hashing walk the
 * tree with an explicit stack, so nesting depth is bounded by heap, not by the call stack.
 *
 * <p>
 * Not thread-safe. A tree is owned by one caller at a time.
 */
public final class Node {

    private String tag;
    private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String text;
    private boolean cdata;
    private Node parent;

    /**
     * Creates an empty node.
     *
     * @param tag the element kind, e.g. {@code Series}
     * @throws NullPointerException if tag is null
     * @throws IllegalArgumentException if tag is empty
     */
    public Node(String tag) {
        this.tag = requireTag(tag);
    }

    /** Creates a node holding a plain text payload. */
    public static Node leaf(String tag, String text) {
        Node node = new Node(tag);
        node.setText(text);
        return node;
    }

    /** Creates a node holding a text payload that is written as a CDATA section. */
    public static Node cdataLeaf(String tag, String text) {
        Node node = new Node(tag);
        node.setCData(text);
        return node;
    }

    // --- Tag ---

    public String tag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = requireTag(tag);
    }

    /** Returns {@code true} if this node's tag equals the given tag. */
    public boolean is(String tag) {
        return this.tag.equals(tag);
    }

    // --- Attributes ---

    /** Returns an unmodifiable, insertion-ordered view of the attributes. */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /** Returns the attribute value, or {@code null} if absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Sets an attribute. An existing attribute keeps its position; a new one is appended.
     *
     * @throws NullPointerException if name or value is null
     */
    public void setAttribute(String name, String value) {
        Objects.requireNonNull(name, "attribute name must not be null");
        Objects.requireNonNull(value, "attribute value must not be null");
        attributes.put(name, value);
    }

    /** Removes an attribute and returns its former value, or {@code null} if absent. */
    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    /** Replaces all attributes with the given ordered entries. */
    public void replaceAttributes(Map<String, String> ordered) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(ordered);
        attributes.clear();
        copy.forEach(this::setAttribute);
    }

    // --- Text ---

    /** Returns the text payload, or {@code null} if this node carries none. */
    public String text() {
        return text;
    }

    public boolean hasText() {
        return text != null;
    }

    /** Returns {@code true} if the text payload is a CDATA section. */
    public boolean isCData() {
        return cdata;
    }

    /**
     * Sets the text payload, keeping the current CDATA flag so a rewritten script body stays a
     * CDATA section. A {@code null} text clears the payload and the flag.
     */
    public void setText(String text) {
        this.text = text;
        if (text == null) {
            this.cdata = false;
        }
    }

    /** Sets the text payload and marks it as a CDATA section. */
    public void setCData(String text) {
        this.text = Objects.requireNonNull(text, "cdata text must not be null");
        this.cdata = true;
    }

    // --- Children ---

    /** Returns an unmodifiable view of the children in document order. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** Returns a snapshot of the direct children carrying the given tag, in document order. */
    public List<Node> children(String tag) {
        List<Node> matches = new ArrayList<>();
        for (Node child : children) {
            if (child.is(tag)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public int childCount() {
        return children.size();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Node child(int index) {
        return children.get(index);
    }

    /** Returns the first direct child with the given tag. */
    public Optional<Node> firstChild(String tag) {
        for (Node child : children) {
            if (child.is(tag)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** Returns the text of the first direct child with the given tag, if it has any. */
    public Optional<String> childText(String tag) {
        return firstChild(tag).map(Node::text);
    }

    /** Returns the index of the given child (by identity), or {@code -1}. */
    public int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /** Appends a child, detaching it from any previous parent first. Returns the child. */
    public Node addChild(Node child) {
        return insertChild(children.size(), child);
    }

    /**
     * Inserts a child at the given index, detaching it from any previous parent first. When the
     * child is already attached to this node, the index refers to the list after detaching.
     *
     * @return the inserted child
     */
    public Node insertChild(int index, Node child) {
        Objects.requireNonNull(child, "child must not be null");
        if (child == this) {
            throw new IllegalArgumentException("a node cannot be its own child");
        }
        child.detach();
        children.add(index, child);
        child.parent = this;
        return child;
    }

    /** Removes the given child (by identity). Returns {@code false} if it was not a child. */
    public boolean removeChild(Node child) {
        int index = indexOf(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        child.parent = null;
        return true;
    }

    /** Removes every child. */
    public void clearChildren() {
        for (Node child : children) {
            child.parent = null;
        }
        children.clear();
    }

    /**
     * Replaces a child (by identity) with another node at the same position.
     *
     * @return {@code false} if {@code existing} is not a child of this node
     */
    public boolean replaceChild(Node existing, Node replacement) {
        int index = indexOf(existing);
        if (index < 0) {
            return false;
        }
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (replacement == existing) {
            return true;
        }
        replacement.detach();
        // detaching may have shifted the index when replacement was a sibling
        index = indexOf(existing);
        children.set(index, replacement);
        existing.parent = null;
        replacement.parent = this;
        return true;
    }

    // --- Parent ---

    /** Returns the parent, or {@code null} for a detached node or a document root. */
    public Node parent() {
        return parent;
    }

    /** Removes this node from its parent, if any. */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    // --- Copying ---

    /** Returns a detached structural copy of this subtree. */
    public Node deepCopy() {
        Node copy = shallowCopy();
        Deque<Node[]> pending = new ArrayDeque<>();
        pending.push(new Node[] {this, copy});
        while (!pending.isEmpty()) {
            Node[] pair = pending.pop();
            for (Node child : pair[0].children) {
                Node childCopy = child.shallowCopy();
                childCopy.parent = pair[1];
                pair[1].children.add(childCopy);
                pending.push(new Node[] {child, childCopy});
            }
        }
        return copy;
    }

    private Node shallowCopy() {
        Node copy = new Node(tag);
        copy.attributes.putAll(attributes);
        copy.text = text;
        copy.cdata = cdata;
        return copy;
    }

    /**
     * Overwrites this node's tag, attributes, text and children with a copy of {@code source}.
     * The parent link of this node is kept.
     */
    public void restoreFrom(Node source) {
        Node copy = source.deepCopy();
        this.tag = copy.tag;
        this.attributes.clear();
        this.attributes.putAll(copy.attributes);
        this.text = copy.text;
        this.cdata = copy.cdata;
        clearChildren();
        for (Node child : new ArrayList<>(copy.children)) {
            addChild(child);
        }
    }

    // --- Object ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Deque<Node> left = new ArrayDeque<>();
        Deque<Node> right = new ArrayDeque<>();
        left.push(this);
        right.push((Node) o);
        while (!left.isEmpty()) {
            Node a = left.pop();
            Node b = right.pop();
            if (!a.sameLocalContent(b) || a.children.size() != b.children.size()) {
                return false;
            }
            for (int i = 0; i < a.children.size(); i++) {
                left.push(a.children.get(i));
                right.push(b.children.get(i));
            }
        }
        return true;
    }

    private boolean sameLocalContent(Node other) {
        return cdata == other.cdata
                && tag.equals(other.tag)
                && Objects.equals(text, other.text)
                && new ArrayList<>(attributes.entrySet()).equals(new ArrayList<>(other.attributes.entrySet()));
    }

    /** Hashes the subtree in document order; consistent with {@link #equals(Object)}. */
    @Override
    public int hashCode() {
        int hash = 1;
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            hash = 31 * hash + Objects.hash(node.tag, node.attributes, node.text, node.cdata, node.children.size());
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
        }
        return hash;
    }

    /** Compact, deterministic rendering for diagnostics: {@code Tag[a=1]{child,child}("text")}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        sb.append(tag);
        if (!attributes.isEmpty()) {
            sb.append('[');
            boolean first = true;
            for (Map.Entry<String, String> e : attributes.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(e.getKey()).append('=').append(e.getValue());
                first = false;
            }
            sb.append(']');
        }
        if (text != null) {
            sb.append(cdata ? "(cdata \"" : "(\"").append(text).append("\")");
        }
        if (!children.isEmpty()) {
            sb.append('{');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                children.get(i).render(sb);
            }
            sb.append('}');
        }
    }

    private static String requireTag(String tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("tag must not be empty");
        }
        return tag;
    }
}
