package im.arun.menubuilder.validation;

import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeRules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Whole-tree check of the rules that make a menu renderable. Used on every
 * loaded or merged document, and by tests after each engine operation.
 */
public final class TreeInvariants {

    private TreeInvariants() {}

    public static List<InvariantViolation> check(MenuTree tree) {
        List<InvariantViolation> violations = new ArrayList<>();
        checkChildren(tree, MenuTree.ROOT_ID, violations);
        return violations;
    }

    public static Optional<InvariantViolation> firstViolation(MenuTree tree) {
        List<InvariantViolation> violations = check(tree);
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }

    public static boolean holds(MenuTree tree) {
        return check(tree).isEmpty();
    }

    private static void checkChildren(MenuTree tree, long parentId, List<InvariantViolation> violations) {
        List<MenuNode> siblings = tree.childrenOf(parentId);
        Set<String> folderLabels = new HashSet<>();
        MenuNode preceding = null;
        for (MenuNode node : siblings) {
            if (node.getKind().requiresLabel() && (node.getLabel() == null || node.getLabel().trim().isEmpty())) {
                violations.add(violation(tree, node, RuleViolation.MISSING_LABEL));
            }
            if (!NodeRules.isValidOptionBoxPlacement(node, preceding)) {
                violations.add(violation(tree, node, RuleViolation.INVALID_OPTION_BOX_POSITION));
            }
            if (node.isFolder()) {
                if (node.getLabel() != null && !folderLabels.add(node.getLabel().trim())) {
                    violations.add(violation(tree, node, RuleViolation.DUPLICATE_FOLDER_LABEL));
                }
                checkChildren(tree, node.getId(), violations);
            }
            preceding = node;
        }
    }

    private static InvariantViolation violation(MenuTree tree, MenuNode node, RuleViolation rule) {
        return new InvariantViolation(node.getId(), tree.describe(node.getId()), rule);
    }
}
