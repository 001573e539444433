package im.arun.menubuilder.validation;

import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.model.NodeKind;
import im.arun.menubuilder.model.NodeRules;

import java.util.Optional;

/**
 * Structural legality queries. Nothing here mutates the tree, so the same
 * checks back both the structure engine and live drag feedback.
 *
 * <p>Each {@code checkX} returns the first rule the operation would break;
 * {@code canX} is the boolean shorthand.
 */
public final class LegalityValidator {

    private LegalityValidator() {}

    /**
     * Attribute rules that depend only on the node kind.
     */
    public static Optional<RuleViolation> checkAttributes(NodeKind kind, NodeAttributes attributes) {
        if (kind == null) {
            return Optional.of(RuleViolation.UNKNOWN_KIND);
        }
        switch (kind) {
            case SEPARATOR:
                if (attributes.isOptionBox()) {
                    return Optional.of(RuleViolation.OPTION_BOX_REQUIRES_COMMAND);
                }
                if (attributes.hasCommandData() || attributes.getIconRef() != null) {
                    return Optional.of(RuleViolation.ATTRIBUTE_NOT_ALLOWED);
                }
                return Optional.empty();
            case FOLDER:
                if (attributes.isOptionBox()) {
                    return Optional.of(RuleViolation.OPTION_BOX_REQUIRES_COMMAND);
                }
                if (attributes.hasCommandData()) {
                    return Optional.of(RuleViolation.ATTRIBUTE_NOT_ALLOWED);
                }
                return attributes.hasLabel() ? Optional.empty() : Optional.of(RuleViolation.MISSING_LABEL);
            case COMMAND:
                return attributes.hasLabel() ? Optional.empty() : Optional.of(RuleViolation.MISSING_LABEL);
            default:
                return Optional.of(RuleViolation.UNKNOWN_KIND);
        }
    }

    public static Optional<RuleViolation> checkDraft(NodeDraft draft) {
        return checkAttributes(draft.getKind(), draft.getAttributes());
    }

    /**
     * Cycle guard and folder check for relocating a subtree.
     */
    public static Optional<RuleViolation> checkMoveInto(MenuTree tree, long sourceId, long destinationId) {
        if (!tree.contains(sourceId) || sourceId == MenuTree.ROOT_ID || !tree.contains(destinationId)) {
            return Optional.of(RuleViolation.NOT_FOUND);
        }
        if (destinationId == sourceId || tree.isAncestor(sourceId, destinationId)) {
            return Optional.of(RuleViolation.CYCLIC_MOVE);
        }
        if (!tree.isFolder(destinationId)) {
            return Optional.of(RuleViolation.PARENT_MUST_BE_FOLDER);
        }
        return Optional.empty();
    }

    public static boolean canMoveInto(MenuTree tree, long sourceId, long destinationId) {
        return checkMoveInto(tree, sourceId, destinationId).isEmpty();
    }

    /**
     * Whether {@code node} may be inserted at {@code targetIndex} among the
     * current children of {@code targetParentId}. The node itself must not be
     * in that child list.
     */
    public static Optional<RuleViolation> checkInsertAt(MenuTree tree, MenuNode node, long targetParentId,
                                                        int targetIndex) {
        if (!tree.contains(targetParentId)) {
            return Optional.of(RuleViolation.NOT_FOUND);
        }
        if (!tree.isFolder(targetParentId)) {
            return Optional.of(RuleViolation.PARENT_MUST_BE_FOLDER);
        }
        int size = tree.childIdsOf(targetParentId).size();
        if (targetIndex < 0 || targetIndex > size) {
            return Optional.of(RuleViolation.INDEX_OUT_OF_RANGE);
        }
        MenuNode preceding = tree.childAt(targetParentId, targetIndex - 1);
        if (!NodeRules.isValidOptionBoxPlacement(node, preceding)) {
            return Optional.of(RuleViolation.INVALID_OPTION_BOX_POSITION);
        }
        MenuNode following = tree.childAt(targetParentId, targetIndex);
        if (following != null && following.isOptionBox()) {
            return Optional.of(RuleViolation.OPTION_BOX_PAIR_SPLIT);
        }
        if (node.isFolder()) {
            return checkFolderLabel(tree, targetParentId, node.getLabel(), node.getId());
        }
        return Optional.empty();
    }

    public static boolean canInsertAt(MenuTree tree, MenuNode node, long targetParentId, int targetIndex) {
        return checkInsertAt(tree, node, targetParentId, targetIndex).isEmpty();
    }

    /**
     * Re-checks the option-box rules for a node that stays where it is.
     */
    public static Optional<RuleViolation> checkBecomeOptionBox(MenuTree tree, MenuNode node, long currentParentId,
                                                               int currentIndex) {
        if (!node.isCommand()) {
            return Optional.of(RuleViolation.OPTION_BOX_REQUIRES_COMMAND);
        }
        MenuNode preceding = tree.childAt(currentParentId, currentIndex - 1);
        if (preceding == null || !preceding.isCommand() || preceding.isOptionBox()) {
            return Optional.of(RuleViolation.INVALID_OPTION_BOX_POSITION);
        }
        // a command that already anchors an option-box cannot become one itself
        MenuNode following = tree.childAt(currentParentId, currentIndex + 1);
        if (following != null && following.isOptionBox()) {
            return Optional.of(RuleViolation.INVALID_OPTION_BOX_POSITION);
        }
        return Optional.empty();
    }

    public static Optional<RuleViolation> checkBecomeOptionBox(MenuTree tree, long nodeId) {
        Optional<MenuNode> node = tree.find(nodeId);
        if (node.isEmpty()) {
            return Optional.of(RuleViolation.NOT_FOUND);
        }
        return checkBecomeOptionBox(tree, node.get(), tree.parentOf(nodeId), tree.indexOf(nodeId));
    }

    public static boolean canBecomeOptionBox(MenuTree tree, MenuNode node, long currentParentId, int currentIndex) {
        return checkBecomeOptionBox(tree, node, currentParentId, currentIndex).isEmpty();
    }

    /**
     * Deletion is always allowed; dependants are handled by the cascade policy.
     */
    public static boolean canDelete(MenuNode node) {
        return true;
    }

    /**
     * The option-box anchored to {@code nodeId}, if it has one.
     */
    public static Optional<Long> dependentOptionBox(MenuTree tree, long nodeId) {
        Optional<MenuNode> node = tree.find(nodeId);
        if (node.isEmpty() || !node.get().isCommand() || node.get().isOptionBox()) {
            return Optional.empty();
        }
        MenuNode following = tree.childAt(tree.parentOf(nodeId), tree.indexOf(nodeId) + 1);
        if (following != null && following.isOptionBox()) {
            return Optional.of(following.getId());
        }
        return Optional.empty();
    }

    /**
     * Sibling folders need distinct labels so that paths stay unambiguous.
     */
    public static Optional<RuleViolation> checkFolderLabel(MenuTree tree, long parentId, String label, long selfId) {
        if (label == null) {
            return Optional.of(RuleViolation.MISSING_LABEL);
        }
        for (MenuNode sibling : tree.childrenOf(parentId)) {
            if (sibling.isFolder() && sibling.getId() != selfId && sibling.getLabel() != null
                && label.trim().equals(sibling.getLabel().trim())) {
                return Optional.of(RuleViolation.DUPLICATE_FOLDER_LABEL);
            }
        }
        return Optional.empty();
    }
}
