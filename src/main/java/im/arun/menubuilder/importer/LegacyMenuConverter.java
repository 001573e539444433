package im.arun.menubuilder.importer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.SeparatorNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts the older flat menu format into a menu tree. The result is not
 * validated here; open or merge it through the structure engine.
 */
public class LegacyMenuConverter {

    private static final Set<String> DIVIDER_LABELS = Set.of("-", "---", "separator");
    private static final String MEL_PREFIX = "mel:";
    private static final int DEFAULT_ORDER = 10;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<LegacyMenuItem> read(Path legacyFile) throws IOException {
        return objectMapper.readValue(legacyFile.toFile(), new TypeReference<List<LegacyMenuItem>>() {});
    }

    /**
     * Build the tree: items in {@code order}, each under the folders named by
     * its submenu path, folders created on first use.
     */
    public MenuTree toTree(List<LegacyMenuItem> items) {
        MenuTree tree = new MenuTree();
        if (items == null || items.isEmpty()) {
            return tree;
        }

        List<LegacyMenuItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt(item -> item.getOrder() != null ? item.getOrder() : DEFAULT_ORDER));

        // Folder ids by full submenu path
        Map<String, Long> folders = new HashMap<>();
        folders.put("", MenuTree.ROOT_ID);

        for (LegacyMenuItem item : sorted) {
            long parentId = ensureFolders(tree, folders, item.getSubMenuPath());
            if (isDivider(item)) {
                tree.append(new SeparatorNode(tree.allocateId()), parentId);
                continue;
            }
            String command = item.getFunctionStr() != null ? item.getFunctionStr().trim() : "";
            CommandLanguage language = CommandLanguage.PYTHON;
            if (command.toLowerCase(Locale.ROOT).startsWith(MEL_PREFIX)) {
                command = command.substring(MEL_PREFIX.length()).trim();
                language = CommandLanguage.MEL;
            } else if ("mel".equalsIgnoreCase(item.getCommandType())) {
                language = CommandLanguage.MEL;
            }
            String icon = item.getIconPath() != null && !item.getIconPath().isEmpty() ? item.getIconPath() : null;
            tree.append(new CommandNode(tree.allocateId(), item.getMenuLabel(), language, command, icon,
                Boolean.TRUE.equals(item.getOptionBox())), parentId);
        }
        return tree;
    }

    private long ensureFolders(MenuTree tree, Map<String, Long> folders, String subMenuPath) {
        if (subMenuPath == null || subMenuPath.trim().isEmpty()) {
            return MenuTree.ROOT_ID;
        }
        long parentId = MenuTree.ROOT_ID;
        String key = "";
        for (String part : subMenuPath.split(MenuTree.PATH_DELIMITER)) {
            String label = part.trim();
            if (label.isEmpty()) {
                continue;
            }
            key = key.isEmpty() ? label : key + MenuTree.PATH_DELIMITER + label;
            Long existing = folders.get(key);
            if (existing == null) {
                FolderNode folder = new FolderNode(tree.allocateId(), label, null);
                tree.append(folder, parentId);
                existing = folder.getId();
                folders.put(key, existing);
            }
            parentId = existing;
        }
        return parentId;
    }

    private static boolean isDivider(LegacyMenuItem item) {
        if (Boolean.TRUE.equals(item.getDivider())) {
            return true;
        }
        return item.getMenuLabel() != null && DIVIDER_LABELS.contains(item.getMenuLabel().trim().toLowerCase(Locale.ROOT));
    }
}
