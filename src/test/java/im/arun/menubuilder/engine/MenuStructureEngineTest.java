package im.arun.menubuilder.engine;

import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.model.SeparatorNode;
import im.arun.menubuilder.validation.Outcome;
import im.arun.menubuilder.validation.RuleViolation;
import im.arun.menubuilder.validation.TreeInvariants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class MenuStructureEngineTest {

    private MenuStructureEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MenuStructureEngine();
    }

    private long add(NodeDraft draft, long parentId) {
        Outcome<Long> outcome = engine.appendNode(draft, parentId);
        assertThat(outcome.isSuccess()).as(outcome.toString()).isTrue();
        return outcome.getValue();
    }

    private static NodeDraft command(String label) {
        return NodeDraft.command(label, CommandLanguage.PYTHON, label.toLowerCase() + "()");
    }

    private static NodeDraft optionBox(String label) {
        return NodeDraft.optionBox(label, CommandLanguage.PYTHON, label.toLowerCase() + "()");
    }

    private List<String> labels(long parentId) {
        return engine.children(parentId).stream()
            .map(child -> child.getLabel() == null ? "----" : child.getLabel())
            .collect(Collectors.toList());
    }

    @Test
    void addAssignsFreshIds() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long sphere = add(command("Sphere"), tools);

        assertThat(sphere).isNotEqualTo(tools);
        assertThat(engine.find(sphere)).hasValueSatisfying(snapshot -> {
            assertThat(snapshot.getParentId()).isEqualTo(tools);
            assertThat(snapshot.getPath()).isEqualTo("Tools");
        });
        assertThat(engine.size()).isEqualTo(2);
    }

    @Test
    void refusedAddDoesNotConsumeAnId() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        Outcome<Long> refused = engine.addNode(optionBox("Options"), tools, 0);
        long next = add(command("Sphere"), tools);

        assertThat(refused.failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(next).isEqualTo(tools + 1);
    }

    @Test
    void optionBoxPlacementRules() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        long b = add(optionBox("B"), MenuTree.ROOT_ID);

        assertThat(engine.addNode(command("C"), MenuTree.ROOT_ID, 1).failedWith(RuleViolation.OPTION_BOX_PAIR_SPLIT))
            .isTrue();
        assertThat(engine.addNode(optionBox("D"), MenuTree.ROOT_ID, 0)
            .failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(labels(MenuTree.ROOT_ID)).containsExactly("A", "B");

        assertThat(engine.toggleOptionBox(b, false).isSuccess()).isTrue();
        assertThat(engine.addNode(command("C"), MenuTree.ROOT_ID, 1).isSuccess()).isTrue();
        assertThat(labels(MenuTree.ROOT_ID)).containsExactly("A", "C", "B");
        assertThat(engine.find(a)).isPresent();
    }

    @Test
    void toggleOptionBoxChecksPosition() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long a = add(command("A"), tools);
        long b = add(command("B"), tools);
        long separator = add(NodeDraft.separator(), tools);

        assertThat(engine.toggleOptionBox(a, true).failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(engine.toggleOptionBox(separator, true).failedWith(RuleViolation.OPTION_BOX_REQUIRES_COMMAND))
            .isTrue();
        assertThat(engine.toggleOptionBox(b, true).isSuccess()).isTrue();
        // A now anchors B, so it cannot itself become one
        assertThat(engine.toggleOptionBox(a, true).isFailure()).isTrue();
        assertThat(engine.toggleOptionBox(999, true).failedWith(RuleViolation.NOT_FOUND)).isTrue();
    }

    @Test
    void editModeIsExclusive() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        long b = add(command("B"), MenuTree.ROOT_ID);

        Outcome<NodeSnapshot> editing = engine.beginEdit(a);
        assertThat(editing.isSuccess()).isTrue();
        assertThat(editing.getValue().getLabel()).isEqualTo("A");
        assertThat(engine.getEditState().isEditing(a)).isTrue();

        assertThat(engine.beginEdit(b).failedWith(RuleViolation.EDIT_IN_PROGRESS)).isTrue();
        assertThat(engine.addNode(command("C"), MenuTree.ROOT_ID, 0).failedWith(RuleViolation.EDIT_IN_PROGRESS))
            .isTrue();
        assertThat(engine.moveNode(b, MenuTree.ROOT_ID, 0).failedWith(RuleViolation.EDIT_IN_PROGRESS)).isTrue();
        assertThat(engine.deleteNode(b).failedWith(RuleViolation.EDIT_IN_PROGRESS)).isTrue();
        assertThat(engine.toggleOptionBox(b, true).failedWith(RuleViolation.EDIT_IN_PROGRESS)).isTrue();
        assertThat(engine.beginEdit(a).isSuccess()).isTrue();

        engine.cancelEdit();
        assertThat(engine.getEditState()).isEqualTo(EditState.IDLE);
        assertThat(engine.beginEdit(b).isSuccess()).isTrue();
    }

    @Test
    void commitAppliesAttributesAndLeavesEditMode() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        NodeSnapshot snapshot = engine.beginEdit(a).getValue();

        Outcome<Void> committed = engine.commitEdit(snapshot.getAttributes().toBuilder()
            .label("Renamed")
            .language(CommandLanguage.MEL)
            .commandText("polySphere;")
            .build());

        assertThat(committed.isSuccess()).isTrue();
        assertThat(engine.getEditState().isIdle()).isTrue();
        NodeAttributes stored = engine.find(a).get().getAttributes();
        assertThat(stored.getLabel()).isEqualTo("Renamed");
        assertThat(stored.getLanguage()).isEqualTo(CommandLanguage.MEL);
    }

    @Test
    void failedCommitKeepsEditMode() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        NodeSnapshot snapshot = engine.beginEdit(a).getValue();

        Outcome<Void> blank = engine.commitEdit(snapshot.getAttributes().toBuilder().label("").build());
        Outcome<Void> optionBox = engine.commitEdit(snapshot.getAttributes().toBuilder().optionBox(true).build());

        assertThat(blank.failedWith(RuleViolation.MISSING_LABEL)).isTrue();
        assertThat(optionBox.failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(engine.getEditState().isEditing(a)).isTrue();
        assertThat(engine.find(a).get().getLabel()).isEqualTo("A");
    }

    @Test
    void commitAndCancelOutsideEditMode() {
        assertThat(engine.commitEdit(NodeAttributes.builder().label("x").build()).failedWith(RuleViolation.NOT_EDITING))
            .isTrue();
        engine.cancelEdit();
        assertThat(engine.getEditState().isIdle()).isTrue();
    }

    @Test
    void separatorsAreNotEditable() {
        long separator = add(NodeDraft.separator(), MenuTree.ROOT_ID);

        assertThat(engine.beginEdit(separator).failedWith(RuleViolation.NOT_EDITABLE)).isTrue();
        assertThat(engine.beginEdit(12345).failedWith(RuleViolation.NOT_FOUND)).isTrue();
        assertThat(engine.getEditState().isIdle()).isTrue();
    }

    @Test
    void renamingAFolderOntoASiblingIsRefused() {
        add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long other = add(NodeDraft.folder("Other"), MenuTree.ROOT_ID);
        NodeSnapshot snapshot = engine.beginEdit(other).getValue();

        assertThat(engine.commitEdit(snapshot.getAttributes().toBuilder().label("Tools").build())
            .failedWith(RuleViolation.DUPLICATE_FOLDER_LABEL)).isTrue();
        engine.cancelEdit();
        assertThat(engine.addNode(NodeDraft.folder("Tools"), MenuTree.ROOT_ID, 0)
            .failedWith(RuleViolation.DUPLICATE_FOLDER_LABEL)).isTrue();
    }

    @Test
    void deleteDemotesTheOptionBoxByDefault() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        long b = add(optionBox("B"), MenuTree.ROOT_ID);

        DeletedSet deleted = engine.deleteNode(a).getValue();

        assertThat(deleted.getDeletedIds()).containsExactly(a);
        assertThat(deleted.getDemotedIds()).containsExactly(b);
        assertThat(engine.find(b).get().isOptionBox()).isFalse();
        assertThat(TreeInvariants.holds(engine.snapshotTree())).isTrue();
    }

    @Test
    void deleteCanCascadeToTheOptionBox() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        long b = add(optionBox("B"), MenuTree.ROOT_ID);
        long c = add(command("C"), MenuTree.ROOT_ID);

        DeletedSet deleted = engine.deleteNode(a, CascadePolicy.DELETE).getValue();

        assertThat(deleted.getDeletedIds()).containsExactly(a, b);
        assertThat(deleted.getDemotedIds()).isEmpty();
        assertThat(labels(MenuTree.ROOT_ID)).containsExactly("C");
        assertThat(engine.find(c)).isPresent();
    }

    @Test
    void deleteFolderRemovesDescendants() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long inner = add(NodeDraft.folder("Inner"), tools);
        long a = add(command("A"), inner);

        DeletedSet deleted = engine.deleteNode(tools).getValue();

        assertThat(deleted.getDeletedIds()).containsExactly(tools, inner, a);
        assertThat(engine.size()).isZero();
        assertThat(engine.deleteNode(tools).failedWith(RuleViolation.NOT_FOUND)).isTrue();
    }

    @Test
    void moveIntoOwnDescendantIsRefusedAndTreeUnchanged() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long inner = add(NodeDraft.folder("Inner"), tools);
        MenuTree before = engine.snapshotTree();

        assertThat(engine.moveNode(tools, inner, 0).failedWith(RuleViolation.CYCLIC_MOVE)).isTrue();
        assertThat(engine.canMoveTo(tools, inner, 0)).isFalse();
        assertThat(engine.snapshotTree()).isEqualTo(before);
    }

    @Test
    void optionBoxTravelsWithItsCommand() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        long other = add(NodeDraft.folder("Other"), MenuTree.ROOT_ID);
        long a = add(command("A"), tools);
        add(optionBox("B"), tools);
        add(command("C"), tools);
        add(command("X"), other);

        assertThat(engine.moveNode(a, other, 1).isSuccess()).isTrue();

        assertThat(labels(tools)).containsExactly("C");
        assertThat(labels(other)).containsExactly("X", "A", "B");
        assertThat(TreeInvariants.holds(engine.snapshotTree())).isTrue();
    }

    @Test
    void moveWithinTheSameFolder() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        add(optionBox("B"), MenuTree.ROOT_ID);
        add(command("C"), MenuTree.ROOT_ID);
        add(command("D"), MenuTree.ROOT_ID);

        assertThat(engine.moveNode(a, MenuTree.ROOT_ID, 2).isSuccess()).isTrue();
        assertThat(labels(MenuTree.ROOT_ID)).containsExactly("C", "D", "A", "B");
    }

    @Test
    void moveRefusesPositionsThatBreakOptionBoxRules() {
        long a = add(command("A"), MenuTree.ROOT_ID);
        long b = add(optionBox("B"), MenuTree.ROOT_ID);
        long separator = add(NodeDraft.separator(), MenuTree.ROOT_ID);
        MenuTree before = engine.snapshotTree();

        assertThat(engine.moveNode(separator, MenuTree.ROOT_ID, 1).failedWith(RuleViolation.OPTION_BOX_PAIR_SPLIT))
            .isTrue();
        assertThat(engine.moveNode(b, MenuTree.ROOT_ID, 2).failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION))
            .isTrue();
        assertThat(engine.moveNode(a, MenuTree.ROOT_ID, 5).failedWith(RuleViolation.INDEX_OUT_OF_RANGE)).isTrue();
        assertThat(engine.moveNode(a, a, 0).failedWith(RuleViolation.CYCLIC_MOVE)).isTrue();
        assertThat(engine.snapshotTree()).isEqualTo(before);
    }

    @Test
    void openRejectsTreesThatBreakTheRules() {
        MenuTree broken = new MenuTree();
        broken.append(NodeDraft.optionBox("Lonely", CommandLanguage.PYTHON, "x()").toNode(broken.allocateId()),
            MenuTree.ROOT_ID);
        add(command("A"), MenuTree.ROOT_ID);

        assertThat(engine.open(broken).failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(labels(MenuTree.ROOT_ID)).containsExactly("A");
        assertThat(engine.newDocument().isSuccess()).isTrue();
        assertThat(engine.size()).isZero();
    }

    @Test
    void traversalAttachesOptionBoxesToTheirCommand() {
        long tools = add(NodeDraft.folder("Tools"), MenuTree.ROOT_ID);
        add(command("A"), tools);
        add(optionBox("B"), tools);
        add(NodeDraft.separator(), tools);
        StringBuilder events = new StringBuilder();

        engine.traverse(new MenuVisitor() {
            @Override
            public void enterFolder(FolderNode folder, int depth) {
                events.append("enter ").append(folder.getLabel()).append(';');
            }

            @Override
            public void exitFolder(FolderNode folder, int depth) {
                events.append("exit ").append(folder.getLabel()).append(';');
            }

            @Override
            public void visitCommand(CommandNode command,
                                     CommandNode optionBox, int depth) {
                events.append(command.getLabel()).append('@').append(depth);
                if (optionBox != null) {
                    events.append('+').append(optionBox.getLabel());
                }
                events.append(';');
            }

            @Override
            public void visitSeparator(SeparatorNode separator, int depth) {
                events.append("sep;");
            }
        });

        assertThat(events.toString()).isEqualTo("enter Tools;A@1+B;sep;exit Tools;");
    }
}
