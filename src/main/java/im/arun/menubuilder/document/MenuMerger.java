package im.arun.menubuilder.document;

import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.validation.InvariantViolation;
import im.arun.menubuilder.validation.Outcome;
import im.arun.menubuilder.validation.TreeInvariants;

import java.util.Optional;

/**
 * Combines two menu trees without reordering anything already in the base.
 *
 * <p>Incoming entries are appended to the matching level of the base. An
 * incoming folder whose label matches a folder already at that level is merged
 * into it recursively instead of being added twice. Incoming ids below the
 * base's id high-water mark, or already taken, are re-keyed.
 */
public final class MenuMerger {

    private MenuMerger() {}

    /**
     * @return the merged tree, or the first rule the merged tree would break;
     *         the base tree is never modified
     */
    public static Outcome<MenuTree> merge(MenuTree base, MenuTree incoming) {
        MenuTree result = base.copy();
        long reservedBelow = base.getNextId();
        mergeChildren(incoming, MenuTree.ROOT_ID, result, MenuTree.ROOT_ID, reservedBelow);

        Optional<InvariantViolation> violation = TreeInvariants.firstViolation(result);
        if (violation.isPresent()) {
            return Outcome.failure(violation.get().getRule(), violation.get().toString());
        }
        return Outcome.success(result);
    }

    private static void mergeChildren(MenuTree source, long sourceParentId, MenuTree target, long targetParentId,
                                      long reservedBelow) {
        for (MenuNode node : source.childrenOf(sourceParentId)) {
            if (node.isFolder()) {
                Optional<MenuNode> sameNamed = findFolder(target, targetParentId, node.getLabel());
                if (sameNamed.isPresent()) {
                    mergeChildren(source, node.getId(), target, sameNamed.get().getId(), reservedBelow);
                    continue;
                }
            }
            copySubtree(source, node, target, targetParentId, reservedBelow);
        }
    }

    private static void copySubtree(MenuTree source, MenuNode node, MenuTree target, long targetParentId,
                                    long reservedBelow) {
        long id = node.getId();
        boolean collides = id < reservedBelow || target.contains(id);
        MenuNode copy = collides ? node.withId(target.allocateId()) : node;
        target.append(copy, targetParentId);
        for (MenuNode child : source.childrenOf(node.getId())) {
            copySubtree(source, child, target, copy.getId(), reservedBelow);
        }
    }

    private static Optional<MenuNode> findFolder(MenuTree tree, long parentId, String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (MenuNode sibling : tree.childrenOf(parentId)) {
            if (sibling.isFolder() && sibling.getLabel() != null && sibling.getLabel().trim().equals(label.trim())) {
                return Optional.of(sibling);
            }
        }
        return Optional.empty();
    }
}
