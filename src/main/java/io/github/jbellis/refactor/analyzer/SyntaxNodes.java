package io.github.jbellis.refactor.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Navigation helpers over tree-sitter nodes.
 * <p>
 * TSNode is a value wrapper around a native struct, so identity and equals are not meaningful across
 * separate lookups; {@link #same} compares by position and type instead.
 */
public final class SyntaxNodes {
    private SyntaxNodes() {
    }

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /**
     * The child stored under a grammar field, or null when the field is absent.
     */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    public static @Nullable TSNode parent(TSNode node) {
        var parent = node.getParent();
        return isPresent(parent) ? parent : null;
    }

    public static List<TSNode> children(TSNode node) {
        int count = node.getChildCount();
        var result = new ArrayList<TSNode>(count);
        for (int i = 0; i < count; i++) {
            result.add(node.getChild(i));
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        int count = node.getNamedChildCount();
        var result = new ArrayList<TSNode>(count);
        for (int i = 0; i < count; i++) {
            result.add(node.getNamedChild(i));
        }
        return result;
    }

    public static @Nullable TSNode firstChildOfType(TSNode node, String type) {
        for (var child : children(node)) {
            if (child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * The grammar field under which {@code node} hangs off its parent, or null.
     */
    public static @Nullable String fieldName(TSNode node) {
        var parent = parent(node);
        if (parent == null) {
            return null;
        }
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            if (same(parent.getChild(i), node)) {
                return parent.getFieldNameForChild(i);
            }
        }
        return null;
    }

    public static boolean same(@Nullable TSNode a, @Nullable TSNode b) {
        if (!isPresent(a) || !isPresent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
               && a.getEndByte() == b.getEndByte()
               && a.getType().equals(b.getType());
    }

    public static @Nullable TSNode ancestor(TSNode node, Set<String> types) {
        var current = parent(node);
        while (current != null) {
            if (types.contains(current.getType())) {
                return current;
            }
            current = parent(current);
        }
        return null;
    }

    /**
     * Pre-order traversal. The visitor returns false to skip the children of the node it was given.
     */
    public static void preorder(TSNode root, Predicate<TSNode> visitor) {
        if (!visitor.test(root)) {
            return;
        }
        int count = root.getChildCount();
        for (int i = 0; i < count; i++) {
            preorder(root.getChild(i), visitor);
        }
    }

    /**
     * The deepest node under {@code root} whose extent contains the whole range.
     */
    public static TSNode smallestCovering(TSNode root, ByteRange range) {
        var current = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            int count = current.getChildCount();
            for (int i = 0; i < count; i++) {
                var child = current.getChild(i);
                if (child.getStartByte() <= range.start() && child.getEndByte() >= range.end()) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    /**
     * Named nodes spanning exactly the range, outermost first.
     */
    public static List<TSNode> exactNodes(TSNode root, ByteRange range) {
        var result = new ArrayList<TSNode>();
        var current = root;
        while (true) {
            if (current.isNamed() && current.getStartByte() == range.start() && current.getEndByte() == range.end()) {
                result.add(current);
            }
            TSNode next = null;
            int count = current.getChildCount();
            for (int i = 0; i < count; i++) {
                var child = current.getChild(i);
                if (child.getStartByte() <= range.start() && child.getEndByte() >= range.end()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return result;
            }
            current = next;
        }
    }

    public static @Nullable TSNode findByRange(TSNode root, ByteRange range, Set<String> types) {
        for (var node : exactNodes(root, range)) {
            if (types.contains(node.getType())) {
                return node;
            }
        }
        return null;
    }
}
