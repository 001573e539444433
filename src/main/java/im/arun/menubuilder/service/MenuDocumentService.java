package im.arun.menubuilder.service;

import im.arun.menubuilder.config.MenuBuilderConfig;
import im.arun.menubuilder.document.MenuDocument;
import im.arun.menubuilder.document.MenuDocumentCodec;
import im.arun.menubuilder.document.MenuFormatException;
import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.importer.LegacyMenuConverter;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.validation.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Menu documents stored by name in the configured menu directory, one
 * {@code <name>.json} file per menu, opened into a single structure engine.
 */
public class MenuDocumentService {
    private static final Logger logger = LoggerFactory.getLogger(MenuDocumentService.class);

    public static final String MENU_FILE_EXTENSION = ".json";

    private final MenuBuilderConfig config;
    private final MenuDocumentCodec codec;
    private final MenuStructureEngine engine;
    private final LegacyMenuConverter legacyConverter;

    private String currentMenuName;

    public MenuDocumentService(MenuBuilderConfig config) {
        this(config, new MenuDocumentCodec(), new MenuStructureEngine());
    }

    public MenuDocumentService(MenuBuilderConfig config, MenuDocumentCodec codec, MenuStructureEngine engine) {
        this.config = config;
        this.codec = codec;
        this.engine = engine;
        this.legacyConverter = new LegacyMenuConverter();
    }

    public MenuStructureEngine getEngine() {
        return engine;
    }

    public String getCurrentMenuName() {
        return currentMenuName;
    }

    public Path getMenuDirectory() {
        return Paths.get(config.getMenuItemsDir());
    }

    public Path menuPath(String menuName) {
        if (menuName == null || menuName.trim().isEmpty()
            || menuName.contains("/") || menuName.contains("\\") || menuName.startsWith(".")) {
            throw new IllegalArgumentException("Invalid menu name: " + menuName);
        }
        return getMenuDirectory().resolve(menuName.trim() + MENU_FILE_EXTENSION);
    }

    /**
     * Names of the menus in the menu directory, sorted. Empty when the
     * directory does not exist yet.
     */
    public List<String> listMenus() throws IOException {
        Path directory = getMenuDirectory();
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile)
                .map(path -> path.getFileName().toString())
                .filter(fileName -> fileName.endsWith(MENU_FILE_EXTENSION))
                .map(fileName -> fileName.substring(0, fileName.length() - MENU_FILE_EXTENSION.length()))
                .sorted()
                .forEach(names::add);
        }
        return names;
    }

    /**
     * Open a menu by name, replacing whatever the engine holds.
     *
     * @throws MenuFormatException if the stored document breaks a menu rule
     */
    public Outcome<Void> open(String menuName) throws IOException, MenuFormatException {
        Outcome<Void> outcome = openFile(menuPath(menuName));
        if (outcome.isSuccess()) {
            currentMenuName = menuName.trim();
        }
        return outcome;
    }

    public Outcome<Void> openFile(Path file) throws IOException, MenuFormatException {
        logger.debug("Opening menu document {}", file);
        MenuTree tree = readTree(file);
        Outcome<Void> outcome = engine.open(tree);
        if (outcome.isFailure()) {
            logger.warn("Could not open {}: {}", file, outcome.getDetail());
        } else {
            logger.info("Opened {} ({} entries)", file, tree.size());
        }
        return outcome;
    }

    /**
     * Open the settings' default menu, or start an empty one under that name
     * if it has not been saved yet.
     */
    public Outcome<Void> loadDefault() throws IOException, MenuFormatException {
        String defaultMenu = config.getDefaultMenu();
        if (Files.exists(menuPath(defaultMenu))) {
            return open(defaultMenu);
        }
        logger.info("Default menu {} not found in {}, starting empty", defaultMenu, getMenuDirectory());
        Outcome<Void> outcome = engine.newDocument();
        if (outcome.isSuccess()) {
            currentMenuName = defaultMenu;
        }
        return outcome;
    }

    /**
     * Start an empty menu under a new name. Nothing is written until saved.
     */
    public Outcome<Void> newMenu(String menuName) {
        menuPath(menuName);
        Outcome<Void> outcome = engine.newDocument();
        if (outcome.isSuccess()) {
            currentMenuName = menuName.trim();
        }
        return outcome;
    }

    /**
     * @throws IllegalStateException if no menu name has been set yet
     */
    public Path save() throws IOException {
        if (currentMenuName == null) {
            throw new IllegalStateException("No menu is open; use saveAs");
        }
        return saveAs(currentMenuName);
    }

    public Path saveAs(String menuName) throws IOException {
        Path target = menuPath(menuName);
        MenuDocument document = codec.serialize(engine.snapshotTree(), menuName.trim());
        codec.write(document, target);
        currentMenuName = menuName.trim();
        logger.info("Saved menu {} to {}", currentMenuName, target);
        return target;
    }

    /**
     * Merge a stored menu into the open one. Rejected wholesale if the result
     * would break a menu rule.
     */
    public Outcome<Void> merge(String menuName) throws IOException, MenuFormatException {
        return mergeFile(menuPath(menuName));
    }

    public Outcome<Void> mergeFile(Path file) throws IOException, MenuFormatException {
        // Placement rules are checked on the merged result only
        MenuTree incoming = codec.deserializeLenient(codec.read(file));
        Outcome<Void> outcome = engine.merge(incoming);
        if (outcome.isFailure()) {
            logger.warn("Merge of {} rejected: {}", file, outcome.getDetail());
        } else {
            logger.info("Merged {} into {}", file, currentMenuName);
        }
        return outcome;
    }

    /**
     * Convert a file in the older flat format and open it under a new menu name.
     */
    public Outcome<Void> openLegacy(Path legacyFile, String menuName) throws IOException {
        menuPath(menuName);
        MenuTree tree = legacyConverter.toTree(legacyConverter.read(legacyFile));
        Outcome<Void> outcome = engine.open(tree);
        if (outcome.isSuccess()) {
            currentMenuName = menuName.trim();
            logger.info("Converted {} into menu {} ({} entries)", legacyFile, currentMenuName, tree.size());
        } else {
            logger.warn("Converted {} breaks a menu rule: {}", legacyFile, outcome.getDetail());
        }
        return outcome;
    }

    /**
     * Read and fully validate a document without opening it.
     */
    public MenuTree readTree(Path file) throws IOException, MenuFormatException {
        return codec.deserialize(codec.read(file));
    }
}
