package im.arun.menubuilder.service;

import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.model.CallableSignature;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.validation.Outcome;
import im.arun.menubuilder.validation.RuleViolation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImportServiceTest {

    @TempDir
    Path dir;

    private ExecutorService executor;
    private ImportService importService;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        importService = new ImportService(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void listsCallablesInTheBackground() throws Exception {
        Path script = dir.resolve("rig_tools.py");
        Files.writeString(script, "def build_rig():\n    pass\n\ndef clean_up():\n    pass\n");

        List<CallableSignature> callables = importService.listCallables(script).get(5, TimeUnit.SECONDS);

        assertThat(callables).extracting(CallableSignature::getName).containsExactly("build_rig", "clean_up");
    }

    @Test
    void functionDraftsUseTheModuleName() throws Exception {
        Path script = dir.resolve("spheres.mel");
        Files.writeString(script, "global proc makeSpheres() {}\n");

        List<NodeDraft> drafts = importService.functionDrafts(script).get(5, TimeUnit.SECONDS);

        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).getAttributes().getCommandText()).isEqualTo("source \"spheres\";\nmakeSpheres();");
    }

    @Test
    void importsShelfButtons() throws Exception {
        Path shelf = dir.resolve("shelf_Custom.mel");
        Files.writeString(shelf, "shelfButton -label \"Cube\" -command \"polyCube\";\n");

        List<NodeDraft> drafts = importService.importShelf(shelf).get(5, TimeUnit.SECONDS);

        assertThat(drafts).extracting(draft -> draft.getAttributes().getLabel()).containsExactly("Cube");
    }

    @Test
    void missingFileFailsTheFuture() {
        assertThatThrownBy(() -> importService.importShelf(dir.resolve("missing.mel")).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(UncheckedIOException.class);
    }

    @Test
    void addDraftsIsAllOrNothing() {
        MenuStructureEngine engine = new MenuStructureEngine();
        engine.appendNode(NodeDraft.separator(), MenuTree.ROOT_ID);
        MenuTree before = engine.snapshotTree();
        List<NodeDraft> drafts = Arrays.asList(
            NodeDraft.command("A", CommandLanguage.PYTHON, "a()"),
            NodeDraft.separator(),
            NodeDraft.optionBox("Orphan", CommandLanguage.PYTHON, "o()"));

        Outcome<List<Long>> outcome = ImportService.addDrafts(engine, drafts, MenuTree.ROOT_ID);

        assertThat(outcome.failedWith(RuleViolation.INVALID_OPTION_BOX_POSITION)).isTrue();
        assertThat(engine.children(MenuTree.ROOT_ID)).hasSize(1);
        assertThat(engine.snapshotTree().topLevel()).isEqualTo(before.topLevel());
    }

    @Test
    void addDraftsKeepsOrder() {
        MenuStructureEngine engine = new MenuStructureEngine();
        List<NodeDraft> drafts = Arrays.asList(
            NodeDraft.command("A", CommandLanguage.PYTHON, "a()"),
            NodeDraft.optionBox("A Options", CommandLanguage.PYTHON, "o()"));

        Outcome<List<Long>> outcome = ImportService.addDrafts(engine, drafts, MenuTree.ROOT_ID);

        assertThat(outcome.getValue()).hasSize(2);
        assertThat(engine.children(MenuTree.ROOT_ID)).extracting(child -> child.getLabel())
            .containsExactly("A", "A Options");
    }
}
