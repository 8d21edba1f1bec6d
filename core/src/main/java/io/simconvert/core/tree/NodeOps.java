package io.simconvert.core.tree;

import io.simconvert.core.model.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Query and restructuring primitives over the {@link Node} tree.
 *
 * <p>
 * Every operation touches only the nodes it names and is a no-op when its target pattern is
 * absent, so a conversion step can run against documents that never had the old shape.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class NodeOps {

    private NodeOps() {}

    /**
     * Returns every node in the subtree (root included) whose tag matches, in document order.
     * The returned list is a snapshot, so callers may restructure the tree while iterating it.
     */
    public static List<Node> findAllDescendants(Node root, String tag) {
        List<Node> matches = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node.is(tag)) {
                matches.add(node);
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return matches;
    }

    /** Returns every node in the subtree (root included) accepted by the predicate, in document order. */
    public static List<Node> findAll(Node root, Predicate<Node> predicate) {
        List<Node> matches = new ArrayList<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (predicate.test(node)) {
                matches.add(node);
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return matches;
    }

    /** Changes the tag of a node. Attributes, text and children are kept. */
    public static void renameTag(Node node, String newTag) {
        node.setTag(newTag);
    }

    /** Renames every direct child tagged {@code oldTag}. */
    public static void renameChildren(Node parent, String oldTag, String newTag) {
        for (Node child : parent.children(oldTag)) {
            child.setTag(newTag);
        }
    }

    /**
     * Renames an attribute in place. An attribute already named {@code newName} is overwritten
     * and the renamed one keeps the position of {@code oldName}.
     */
    public static void renameAttribute(Node node, String oldName, String newName) {
        if (!node.hasAttribute(oldName) || oldName.equals(newName)) {
            return;
        }
        Map<String, String> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : node.attributes().entrySet()) {
            if (e.getKey().equals(oldName)) {
                renamed.put(newName, e.getValue());
            } else if (!e.getKey().equals(newName)) {
                renamed.put(e.getKey(), e.getValue());
            }
        }
        node.replaceAttributes(renamed);
    }

    /**
     * Moves every direct child accepted by {@code groupingRule} into one new child tagged
     * {@code newTag}. The new child takes the position of the first grouped child; grouped
     * children keep their relative order.
     *
     * @return the new grouping child, or empty if nothing matched
     */
    public static Optional<Node> wrapChildrenAsStructuredChild(Node node, Predicate<Node> groupingRule, String newTag) {
        List<Node> grouped = new ArrayList<>();
        for (Node child : node.children()) {
            if (groupingRule.test(child)) {
                grouped.add(child);
            }
        }
        if (grouped.isEmpty()) {
            return Optional.empty();
        }
        int position = node.indexOf(grouped.get(0));
        Node wrapper = new Node(newTag);
        for (Node child : grouped) {
            wrapper.addChild(child);
        }
        node.insertChild(position, wrapper);
        return Optional.of(wrapper);
    }

    /**
     * Promotes the children of the first direct child tagged {@code childTag} into {@code node},
     * at the group's position, renaming them through {@code fieldRenames} (unmapped tags keep
     * their name). A promoted child whose resulting tag already exists directly on {@code node}
     * is dropped, so two sub-groups sharing a field collapse onto one. The emptied group is
     * removed.
     */
    public static void flattenChild(Node node, String childTag, Map<String, String> fieldRenames) {
        Optional<Node> group = node.firstChild(childTag);
        if (group.isEmpty()) {
            return;
        }
        Node groupNode = group.get();
        int position = node.indexOf(groupNode);
        node.removeChild(groupNode);
        for (Node field : new ArrayList<>(groupNode.children())) {
            String target = fieldRenames.getOrDefault(field.tag(), field.tag());
            if (node.firstChild(target).isPresent()) {
                continue;
            }
            field.setTag(target);
            node.insertChild(position++, field);
        }
    }

    /**
     * Replaces every simple text child tagged {@code childTag} with a record node tagged
     * {@code recordTag} that holds the original text under {@code fieldName}. Order is kept;
     * children that already have element children are left alone.
     *
     * @return the records created, in document order
     */
    public static List<Node> convertTextChildrenToRecords(
            Node node, String childTag, String recordTag, String fieldName) {
        List<Node> records = new ArrayList<>();
        for (Node child : node.children(childTag)) {
            if (child.hasChildren()) {
                continue;
            }
            Node record = new Node(recordTag);
            record.addChild(Node.leaf(fieldName, child.text() == null ? "" : child.text()));
            node.replaceChild(child, record);
            records.add(record);
        }
        return records;
    }

    /**
     * Inserts {@code newNode} immediately after the last direct child tagged {@code afterTag},
     * or appends it when there is no such child. Other siblings keep their order.
     */
    public static void insertSiblingDefault(Node parent, String afterTag, Node newNode) {
        int anchor = -1;
        for (int i = 0; i < parent.childCount(); i++) {
            if (parent.child(i).is(afterTag)) {
                anchor = i;
            }
        }
        parent.insertChild(anchor < 0 ? parent.childCount() : anchor + 1, newNode);
    }

    /**
     * Appends a child {@code <tag><Name>tag</Name></tag>} unless a direct child with that tag
     * already exists.
     *
     * @return {@code true} if a child was added
     */
    public static boolean ensureChild(Node parent, String tag) {
        if (parent.firstChild(tag).isPresent()) {
            return false;
        }
        Node child = new Node(tag);
        child.addChild(Node.leaf("Name", tag));
        parent.addChild(child);
        return true;
    }

    /** Creates or updates a simple text child. */
    public static void setChildText(Node parent, String tag, String value) {
        Optional<Node> existing = parent.firstChild(tag);
        if (existing.isPresent()) {
            existing.get().setText(value);
        } else {
            parent.addChild(Node.leaf(tag, value));
        }
    }

    /** Detaches a node from its parent. A root (no parent) is left as is. */
    public static void deleteNode(Node node) {
        node.detach();
    }

    /**
     * Removes every direct child tagged {@code tag}.
     *
     * @return the number of children removed
     */
    public static int deleteChildren(Node parent, String tag) {
        List<Node> doomed = parent.children(tag);
        doomed.forEach(parent::removeChild);
        return doomed.size();
    }

    /**
     * Puts {@code replacement} where {@code node} was. A root (no parent) cannot be replaced and
     * is left as is.
     *
     * @return {@code true} if the replacement happened
     */
    public static boolean spliceReplace(Node node, Node replacement) {
        Node parent = node.parent();
        if (parent == null) {
            return false;
        }
        return parent.replaceChild(node, replacement);
    }
}
