package im.arun.menubuilder.service;

import im.arun.menubuilder.config.MenuBuilderConfig;
import im.arun.menubuilder.document.MenuDocumentCodec;
import im.arun.menubuilder.document.MenuFormatException;
import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.validation.RuleViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MenuDocumentServiceTest {

    @TempDir
    Path menuDir;

    private MenuDocumentService service;

    @BeforeEach
    void setUp() {
        MenuBuilderConfig config = new MenuBuilderConfig();
        config.setMenuItemsDir(menuDir.toString());
        service = new MenuDocumentService(config);
    }

    private MenuStructureEngine engine() {
        return service.getEngine();
    }

    @Test
    void loadDefaultStartsEmptyWhenNothingIsSaved() throws Exception {
        assertThat(service.loadDefault().isSuccess()).isTrue();

        assertThat(service.getCurrentMenuName()).isEqualTo("TempBar");
        assertThat(engine().size()).isZero();
        assertThat(service.listMenus()).isEmpty();
    }

    @Test
    void saveThenOpenRestoresTheMenu() throws Exception {
        service.newMenu("Modeling");
        long tools = engine().appendNode(NodeDraft.folder("Tools"), MenuTree.ROOT_ID).getValue();
        engine().appendNode(NodeDraft.command("Sphere", CommandLanguage.PYTHON, "cmds.polySphere()"), tools);
        MenuTree saved = engine().snapshotTree();

        Path file = service.save();
        service.newMenu("Scratch");
        assertThat(service.open("Modeling").isSuccess()).isTrue();

        assertThat(file).isEqualTo(menuDir.resolve("Modeling.json"));
        assertThat(engine().snapshotTree()).isEqualTo(saved);
        assertThat(service.getCurrentMenuName()).isEqualTo("Modeling");
    }

    @Test
    void saveAsWritesUnderTheNewName() throws Exception {
        service.newMenu("Modeling");
        engine().appendNode(NodeDraft.separator(), MenuTree.ROOT_ID);

        service.saveAs("Copy");
        service.save();

        assertThat(service.getCurrentMenuName()).isEqualTo("Copy");
        assertThat(service.listMenus()).containsExactly("Copy");
    }

    @Test
    void listsMenusByName() throws Exception {
        service.newMenu("b");
        service.save();
        service.saveAs("a");
        Files.writeString(menuDir.resolve("notes.txt"), "not a menu");

        assertThat(service.listMenus()).containsExactly("a", "b");
    }

    @Test
    void mergeByName() throws Exception {
        service.newMenu("Extra");
        long tools = engine().appendNode(NodeDraft.folder("Tools"), MenuTree.ROOT_ID).getValue();
        engine().appendNode(NodeDraft.command("Cube", CommandLanguage.MEL, "polyCube;"), tools);
        service.save();

        service.newMenu("Main");
        long mainTools = engine().appendNode(NodeDraft.folder("Tools"), MenuTree.ROOT_ID).getValue();
        engine().appendNode(NodeDraft.command("Sphere", CommandLanguage.MEL, "polySphere;"), mainTools);

        assertThat(service.merge("Extra").isSuccess()).isTrue();
        assertThat(engine().children(MenuTree.ROOT_ID)).hasSize(1);
        assertThat(engine().children(mainTools)).extracting(child -> child.getLabel())
            .containsExactly("Sphere", "Cube");
    }

    @Test
    void invalidStoredMenuIsAFormatError() throws Exception {
        Files.writeString(menuDir.resolve("Broken.json"),
            "{\"name\":\"Broken\",\"items\":[{\"id\":1,\"kind\":\"command\",\"label\":\"Lonely\",\"option_box\":true}]}");

        assertThatThrownBy(() -> service.open("Broken"))
            .isInstanceOfSatisfying(MenuFormatException.class,
                e -> assertThat(e.getRule()).isEqualTo(RuleViolation.INVALID_OPTION_BOX_POSITION));
        assertThat(service.getCurrentMenuName()).isNull();
    }

    @Test
    void rejectsNamesThatLeaveTheMenuDirectory() {
        assertThatThrownBy(() -> service.menuPath("../outside")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.menuPath(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.save()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void convertsLegacyFiles() throws Exception {
        Path legacy = menuDir.resolve("legacy.json");
        Files.writeString(legacy, "[{\"sub_menu_path\":\"Tools\",\"function_str\":\"mel: polyCube;\",\"menu_label\":\"Cube\"}]");

        assertThat(service.openLegacy(legacy, "Converted").isSuccess()).isTrue();
        Path saved = service.save();

        assertThat(new MenuDocumentCodec().deserialize(new MenuDocumentCodec().read(saved)).size()).isEqualTo(2);
    }
}
