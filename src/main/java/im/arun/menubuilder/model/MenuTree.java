package im.arun.menubuilder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Arena of menu nodes addressed by id. Each folder (and the virtual root) owns
 * an ordered list of child ids; the order is render order.
 *
 * <p>Mutators on this class are unchecked: they keep the arena consistent but
 * do not enforce placement rules. Callers that need the menu invariants go
 * through the structure engine.
 */
public class MenuTree {

    /** Id of the virtual root folder that holds the top-level entries. */
    public static final long ROOT_ID = 0L;

    public static final String PATH_DELIMITER = "/";

    private final Map<Long, MenuNode> nodes = new HashMap<>();
    private final Map<Long, List<Long>> children = new HashMap<>();
    private final Map<Long, Long> parents = new HashMap<>();
    private long nextId = 1L;

    public MenuTree() {
        children.put(ROOT_ID, new ArrayList<>());
    }

    /**
     * Hand out a fresh id. Ids are never handed out twice by the same tree.
     */
    public long allocateId() {
        return nextId++;
    }

    public long getNextId() {
        return nextId;
    }

    /**
     * Raise the id high-water mark so that ids below {@code next} are never allocated.
     */
    public void reserveIdsBelow(long next) {
        if (next > nextId) {
            nextId = next;
        }
    }

    public boolean contains(long id) {
        return id == ROOT_ID || nodes.containsKey(id);
    }

    public Optional<MenuNode> find(long id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public MenuNode get(long id) {
        MenuNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("No menu node with id " + id);
        }
        return node;
    }

    /**
     * Whether the id names something that can hold children (a folder or the root).
     */
    public boolean isFolder(long id) {
        return children.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Long> childIdsOf(long parentId) {
        List<Long> ids = children.get(parentId);
        if (ids == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(ids);
    }

    public List<MenuNode> childrenOf(long parentId) {
        List<MenuNode> result = new ArrayList<>();
        for (Long childId : childIdsOf(parentId)) {
            result.add(nodes.get(childId));
        }
        return Collections.unmodifiableList(result);
    }

    public List<MenuNode> topLevel() {
        return childrenOf(ROOT_ID);
    }

    public long parentOf(long id) {
        Long parent = parents.get(id);
        if (parent == null) {
            throw new NoSuchElementException("No menu node with id " + id);
        }
        return parent;
    }

    public int indexOf(long id) {
        return children.get(parentOf(id)).indexOf(id);
    }

    /**
     * Child at the given position, or null when the position is outside the list.
     */
    public MenuNode childAt(long parentId, int index) {
        List<Long> ids = children.get(parentId);
        if (ids == null || index < 0 || index >= ids.size()) {
            return null;
        }
        return nodes.get(ids.get(index));
    }

    /**
     * Walks up from {@code id} looking for {@code ancestorId}. The root is an
     * ancestor of every node.
     */
    public boolean isAncestor(long ancestorId, long id) {
        if (!nodes.containsKey(id)) {
            return false;
        }
        long current = parents.get(id);
        while (true) {
            if (current == ancestorId) {
                return true;
            }
            if (current == ROOT_ID) {
                return false;
            }
            current = parents.get(current);
        }
    }

    /**
     * Ids of the subtree rooted at {@code id}, in depth-first pre-order.
     */
    public List<Long> subtreeIds(long id) {
        List<Long> result = new ArrayList<>();
        collect(id, result);
        return result;
    }

    private void collect(long id, List<Long> result) {
        if (id != ROOT_ID) {
            result.add(id);
        }
        for (Long childId : childIdsOf(id)) {
            collect(childId, result);
        }
    }

    /**
     * Ancestor folder labels joined by {@link #PATH_DELIMITER}; empty for top-level nodes.
     */
    public String pathOf(long id) {
        List<String> labels = new ArrayList<>();
        long current = parentOf(id);
        while (current != ROOT_ID) {
            labels.add(0, nodes.get(current).getLabel());
            current = parents.get(current);
        }
        return String.join(PATH_DELIMITER, labels);
    }

    /**
     * Human-readable location of a node, including the node itself. Separators
     * and unlabeled entries are shown by position.
     */
    public String describe(long id) {
        String path = pathOf(id);
        MenuNode node = get(id);
        String self = node.getLabel() != null && !node.getLabel().isEmpty()
            ? node.getLabel()
            : "[" + indexOf(id) + "]";
        return path.isEmpty() ? self : path + PATH_DELIMITER + self;
    }

    public void insert(MenuNode node, long parentId, int index) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.getId()) || node.getId() == ROOT_ID) {
            throw new IllegalArgumentException("Duplicate menu node id " + node.getId());
        }
        List<Long> siblings = children.get(parentId);
        if (siblings == null) {
            throw new IllegalArgumentException("Menu node " + parentId + " cannot hold children");
        }
        if (index < 0 || index > siblings.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside 0.." + siblings.size());
        }
        nodes.put(node.getId(), node);
        parents.put(node.getId(), parentId);
        siblings.add(index, node.getId());
        if (node.getKind().canHaveChildren()) {
            children.put(node.getId(), new ArrayList<>());
        }
        reserveIdsBelow(node.getId() + 1);
    }

    public void append(MenuNode node, long parentId) {
        insert(node, parentId, childIdsOf(parentId).size());
    }

    /**
     * Swap in a new version of an existing node. Kind must not change.
     */
    public void replace(MenuNode node) {
        MenuNode existing = get(node.getId());
        if (existing.getKind() != node.getKind()) {
            throw new IllegalArgumentException("Node kind is immutable: " + existing.getKind()
                + " -> " + node.getKind());
        }
        nodes.put(node.getId(), node);
    }

    /**
     * Remove a node and its whole subtree.
     *
     * @return removed ids in pre-order
     */
    public List<Long> remove(long id) {
        List<Long> removed = subtreeIds(id);
        children.get(parentOf(id)).remove(Long.valueOf(id));
        for (Long removedId : removed) {
            nodes.remove(removedId);
            parents.remove(removedId);
            children.remove(removedId);
        }
        return removed;
    }

    /**
     * Relocate a node (children travel with it). {@code index} addresses the
     * destination list with the node already taken out.
     */
    public void move(long id, long newParentId, int index) {
        List<Long> destination = children.get(newParentId);
        if (destination == null) {
            throw new IllegalArgumentException("Menu node " + newParentId + " cannot hold children");
        }
        if (id == newParentId || isAncestor(id, newParentId)) {
            throw new IllegalArgumentException("Cannot move node " + id + " into its own subtree");
        }
        long oldParentId = parentOf(id);
        int limit = oldParentId == newParentId ? destination.size() - 1 : destination.size();
        if (index < 0 || index > limit) {
            throw new IndexOutOfBoundsException("Index " + index + " outside 0.." + limit);
        }
        detach(id);
        attach(id, newParentId, index);
    }

    /**
     * Unlink a node from its parent's child list. The node and its subtree stay
     * in the arena, unreachable, until {@link #attach} puts them back.
     */
    public void detach(long id) {
        children.get(parentOf(id)).remove(Long.valueOf(id));
        parents.remove(id);
    }

    /**
     * Link a detached node under a new parent.
     */
    public void attach(long id, long parentId, int index) {
        if (!nodes.containsKey(id) || parents.containsKey(id)) {
            throw new IllegalArgumentException("Menu node " + id + " is not detached");
        }
        List<Long> siblings = children.get(parentId);
        if (siblings == null) {
            throw new IllegalArgumentException("Menu node " + parentId + " cannot hold children");
        }
        siblings.add(index, id);
        parents.put(id, parentId);
    }

    public MenuTree copy() {
        MenuTree copy = new MenuTree();
        copy.nodes.putAll(nodes);
        copy.parents.putAll(parents);
        copy.children.clear();
        children.forEach((key, value) -> copy.children.put(key, new ArrayList<>(value)));
        copy.nextId = nextId;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MenuTree)) {
            return false;
        }
        MenuTree other = (MenuTree) o;
        return nextId == other.nextId
            && nodes.equals(other.nodes)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, children, nextId);
    }

    @Override
    public String toString() {
        return "MenuTree(size=" + nodes.size() + ", nextId=" + nextId + ")";
    }
}
