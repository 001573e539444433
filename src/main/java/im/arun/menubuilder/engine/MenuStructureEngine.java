package im.arun.menubuilder.engine;

import im.arun.menubuilder.document.MenuMerger;
import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.model.SeparatorNode;
import im.arun.menubuilder.validation.InvariantViolation;
import im.arun.menubuilder.validation.LegalityValidator;
import im.arun.menubuilder.validation.Outcome;
import im.arun.menubuilder.validation.RuleViolation;
import im.arun.menubuilder.validation.TreeInvariants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Owns the open menu tree and is the only path through which it changes.
 *
 * <p>Every mutating operation checks legality first and either applies fully
 * or returns a failed {@link Outcome} with the tree untouched. While a node is
 * being edited, every mutation other than {@link #commitEdit} and
 * {@link #cancelEdit} is refused with {@link RuleViolation#EDIT_IN_PROGRESS}.
 *
 * <p>Not thread-safe: one caller drives it, one gesture at a time.
 */
public class MenuStructureEngine {

    private MenuTree tree;
    private EditState editState = EditState.IDLE;

    public MenuStructureEngine() {
        this(new MenuTree());
    }

    public MenuStructureEngine(MenuTree tree) {
        this.tree = tree;
    }

    // ---- document lifecycle ----

    public Outcome<Void> newDocument() {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        tree = new MenuTree();
        return Outcome.done();
    }

    /**
     * Replace the open tree wholesale. The replacement is re-validated.
     */
    public Outcome<Void> open(MenuTree replacement) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        Optional<InvariantViolation> violation = TreeInvariants.firstViolation(replacement);
        if (violation.isPresent()) {
            return Outcome.failure(violation.get().getRule(), violation.get().toString());
        }
        tree = replacement.copy();
        return Outcome.done();
    }

    /**
     * Combine another tree into the open one. Rejected wholesale if the result
     * would break an invariant.
     */
    public Outcome<Void> merge(MenuTree incoming) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        Outcome<MenuTree> merged = MenuMerger.merge(tree, incoming);
        if (merged.isFailure()) {
            return merged.asFailure();
        }
        tree = merged.getValue();
        return Outcome.done();
    }

    // ---- read side ----

    /**
     * Independent copy of the current tree, e.g. for saving.
     */
    public MenuTree snapshotTree() {
        return tree.copy();
    }

    public EditState getEditState() {
        return editState;
    }

    public int size() {
        return tree.size();
    }

    public Optional<NodeSnapshot> find(long id) {
        if (id == MenuTree.ROOT_ID || !tree.contains(id)) {
            return Optional.empty();
        }
        return Optional.of(NodeSnapshot.of(tree, id));
    }

    public List<NodeSnapshot> children(long parentId) {
        if (!tree.isFolder(parentId)) {
            return Collections.emptyList();
        }
        List<NodeSnapshot> result = new ArrayList<>();
        for (Long childId : tree.childIdsOf(parentId)) {
            result.add(NodeSnapshot.of(tree, childId));
        }
        return result;
    }

    /**
     * Live drag feedback: would {@code nodeId} be accepted at this position?
     */
    public boolean canMoveTo(long nodeId, long newParentId, int newIndex) {
        return checkMove(nodeId, newParentId, newIndex).isSuccess();
    }

    public void traverse(MenuVisitor visitor) {
        traverse(MenuTree.ROOT_ID, 0, visitor);
    }

    private void traverse(long parentId, int depth, MenuVisitor visitor) {
        List<MenuNode> siblings = tree.childrenOf(parentId);
        for (int i = 0; i < siblings.size(); i++) {
            MenuNode node = siblings.get(i);
            if (node instanceof FolderNode) {
                FolderNode folder = (FolderNode) node;
                visitor.enterFolder(folder, depth);
                traverse(folder.getId(), depth + 1, visitor);
                visitor.exitFolder(folder, depth);
            } else if (node instanceof SeparatorNode) {
                visitor.visitSeparator((SeparatorNode) node, depth);
            } else if (!node.isOptionBox()) {
                MenuNode next = i + 1 < siblings.size() ? siblings.get(i + 1) : null;
                CommandNode optionBox = next != null && next.isOptionBox() ? (CommandNode) next : null;
                visitor.visitCommand((CommandNode) node, optionBox, depth);
            }
        }
    }

    // ---- structural edits ----

    /**
     * Insert a new node; the engine assigns its id.
     */
    public Outcome<Long> addNode(NodeDraft draft, long targetParentId, int targetIndex) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        Optional<RuleViolation> violation = LegalityValidator.checkDraft(draft);
        if (violation.isEmpty()) {
            MenuNode candidate = draft.toNode(tree.getNextId());
            violation = LegalityValidator.checkInsertAt(tree, candidate, targetParentId, targetIndex);
        }
        if (violation.isPresent()) {
            return Outcome.failure(violation.get());
        }
        MenuNode node = draft.toNode(tree.allocateId());
        tree.insert(node, targetParentId, targetIndex);
        return Outcome.success(node.getId());
    }

    public Outcome<Long> appendNode(NodeDraft draft, long targetParentId) {
        return addNode(draft, targetParentId, tree.childIdsOf(targetParentId).size());
    }

    /**
     * Relocate a node with its subtree. A command carrying an option-box takes
     * the option-box along, directly after it. {@code newIndex} addresses the
     * destination list with the moving nodes already taken out.
     */
    public Outcome<Void> moveNode(long nodeId, long newParentId, int newIndex) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        Outcome<MenuTree> moved = checkMove(nodeId, newParentId, newIndex);
        if (moved.isFailure()) {
            return moved.asFailure();
        }
        tree = moved.getValue();
        return Outcome.done();
    }

    private Outcome<MenuTree> checkMove(long nodeId, long newParentId, int newIndex) {
        Optional<RuleViolation> violation = LegalityValidator.checkMoveInto(tree, nodeId, newParentId);
        if (violation.isPresent()) {
            return Outcome.failure(violation.get());
        }
        MenuTree working = tree.copy();
        Optional<Long> follower = LegalityValidator.dependentOptionBox(working, nodeId);
        follower.ifPresent(working::detach);
        working.detach(nodeId);

        violation = LegalityValidator.checkInsertAt(working, working.get(nodeId), newParentId, newIndex);
        if (violation.isPresent()) {
            return Outcome.failure(violation.get());
        }
        working.attach(nodeId, newParentId, newIndex);
        follower.ifPresent(id -> working.attach(id, newParentId, newIndex + 1));
        return Outcome.success(working);
    }

    public Outcome<DeletedSet> deleteNode(long nodeId) {
        return deleteNode(nodeId, CascadePolicy.DEFAULT);
    }

    /**
     * Remove a node and its subtree. If the node anchors an option-box, the
     * cascade policy decides whether the option-box goes too or stays as a
     * plain command.
     */
    public Outcome<DeletedSet> deleteNode(long nodeId, CascadePolicy cascadePolicy) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        if (nodeId == MenuTree.ROOT_ID || !tree.contains(nodeId)) {
            return Outcome.failure(RuleViolation.NOT_FOUND);
        }
        Optional<Long> follower = LegalityValidator.dependentOptionBox(tree, nodeId);
        List<Long> deleted = new ArrayList<>(tree.remove(nodeId));
        List<Long> demoted = new ArrayList<>();
        if (follower.isPresent()) {
            long optionBoxId = follower.get();
            if (cascadePolicy == CascadePolicy.DELETE) {
                deleted.addAll(tree.remove(optionBoxId));
            } else {
                CommandNode optionBox = (CommandNode) tree.get(optionBoxId);
                tree.replace(optionBox.withOptionBox(false));
                demoted.add(optionBoxId);
            }
        }
        return Outcome.success(new DeletedSet(Collections.unmodifiableList(deleted),
            Collections.unmodifiableList(demoted)));
    }

    public Outcome<Void> toggleOptionBox(long nodeId, boolean enable) {
        if (!editState.isIdle()) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        Optional<MenuNode> node = tree.find(nodeId);
        if (node.isEmpty()) {
            return Outcome.failure(RuleViolation.NOT_FOUND);
        }
        if (!node.get().isCommand()) {
            return Outcome.failure(RuleViolation.OPTION_BOX_REQUIRES_COMMAND);
        }
        CommandNode command = (CommandNode) node.get();
        if (command.isOptionBox() == enable) {
            return Outcome.done();
        }
        if (enable) {
            Optional<RuleViolation> violation = LegalityValidator.checkBecomeOptionBox(tree, nodeId);
            if (violation.isPresent()) {
                return Outcome.failure(violation.get());
            }
        }
        tree.replace(command.withOptionBox(enable));
        return Outcome.done();
    }

    // ---- edit mode ----

    /**
     * Enter edit mode for one node and hand back its current attributes.
     */
    public Outcome<NodeSnapshot> beginEdit(long nodeId) {
        if (!editState.isIdle() && !editState.isEditing(nodeId)) {
            return Outcome.failure(RuleViolation.EDIT_IN_PROGRESS);
        }
        if (nodeId == MenuTree.ROOT_ID || !tree.contains(nodeId)) {
            return Outcome.failure(RuleViolation.NOT_FOUND);
        }
        if (tree.get(nodeId).isSeparator()) {
            return Outcome.failure(RuleViolation.NOT_EDITABLE);
        }
        editState = EditState.editing(nodeId);
        return Outcome.success(NodeSnapshot.of(tree, nodeId));
    }

    /**
     * Apply edited attributes to the node in edit mode. The node keeps its
     * position, so only attribute and option-box rules are re-checked. On
     * failure nothing changes and edit mode stays active.
     */
    public Outcome<Void> commitEdit(NodeAttributes updated) {
        if (editState.isIdle()) {
            return Outcome.failure(RuleViolation.NOT_EDITING);
        }
        long nodeId = editState.getNodeId();
        MenuNode current = tree.get(nodeId);
        Optional<RuleViolation> violation = LegalityValidator.checkAttributes(current.getKind(), updated);
        if (violation.isPresent()) {
            return Outcome.failure(violation.get());
        }
        MenuNode candidate = applyAttributes(current, updated);
        long parentId = tree.parentOf(nodeId);
        int index = tree.indexOf(nodeId);
        if (candidate.isFolder()) {
            violation = LegalityValidator.checkFolderLabel(tree, parentId, candidate.getLabel(), nodeId);
        } else if (candidate.isOptionBox()) {
            violation = LegalityValidator.checkBecomeOptionBox(tree, candidate, parentId, index);
        }
        if (violation.isPresent()) {
            return Outcome.failure(violation.get());
        }
        tree.replace(candidate);
        editState = EditState.IDLE;
        return Outcome.done();
    }

    /**
     * Leave edit mode without applying anything. Safe to call when idle.
     */
    public void cancelEdit() {
        editState = EditState.IDLE;
    }

    private static MenuNode applyAttributes(MenuNode current, NodeAttributes updated) {
        if (current instanceof FolderNode) {
            return new FolderNode(current.getId(), updated.getLabel(), updated.getIconRef());
        }
        if (current instanceof CommandNode) {
            return new CommandNode(current.getId(), updated.getLabel(), updated.getLanguage(),
                updated.getCommandText(), updated.getIconRef(), updated.isOptionBox());
        }
        throw new IllegalStateException("Separators have no editable attributes");
    }
}
