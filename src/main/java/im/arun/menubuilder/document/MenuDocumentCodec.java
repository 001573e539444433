package im.arun.menubuilder.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeKind;
import im.arun.menubuilder.model.SeparatorNode;
import im.arun.menubuilder.validation.InvariantViolation;
import im.arun.menubuilder.validation.LegalityValidator;
import im.arun.menubuilder.validation.RuleViolation;
import im.arun.menubuilder.validation.TreeInvariants;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts menu trees to and from {@link MenuDocument} and its JSON text.
 *
 * <p>Documents are untrusted input: {@link #deserialize} re-validates every
 * rule and reports the first offending entry instead of repairing it.
 */
public class MenuDocumentCodec {

    private final ObjectMapper objectMapper;

    public MenuDocumentCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Depth-first, order-preserving encoding of every node.
     */
    public MenuDocument serialize(MenuTree tree, String name) {
        List<MenuItemEntry> items = new ArrayList<>();
        for (MenuNode node : tree.topLevel()) {
            items.add(toEntry(tree, node));
        }
        return new MenuDocument(name, MenuDocument.CURRENT_FORMAT_VERSION, tree.getNextId(), items);
    }

    private MenuItemEntry toEntry(MenuTree tree, MenuNode node) {
        MenuItemEntry entry = new MenuItemEntry();
        entry.setId(node.getId());
        entry.setKind(node.getKind().wireName());
        if (node instanceof FolderNode) {
            FolderNode folder = (FolderNode) node;
            entry.setLabel(folder.getLabel());
            entry.setIcon(folder.getIconRef());
            List<MenuItemEntry> children = new ArrayList<>();
            for (MenuNode child : tree.childrenOf(folder.getId())) {
                children.add(toEntry(tree, child));
            }
            entry.setChildren(children);
        } else if (node instanceof CommandNode) {
            CommandNode command = (CommandNode) node;
            entry.setLabel(command.getLabel());
            entry.setLanguage(command.getLanguage().wireName());
            entry.setCommand(command.getCommandText());
            entry.setIcon(command.getIconRef());
            entry.setOptionBox(command.isOptionBox());
        }
        return entry;
    }

    /**
     * Rebuild a tree and check every menu rule on it.
     *
     * @throws MenuFormatException naming the first offending entry and rule
     */
    public MenuTree deserialize(MenuDocument document) throws MenuFormatException {
        MenuTree tree = deserializeLenient(document);
        Optional<InvariantViolation> violation = TreeInvariants.firstViolation(tree);
        if (violation.isPresent()) {
            throw new MenuFormatException(violation.get().getPath(), violation.get().getRule());
        }
        return tree;
    }

    /**
     * Rebuild a tree checking only per-entry rules (ids, kinds, kind-specific
     * fields). Placement rules are left to the caller, e.g. a merge that
     * validates the combined result.
     */
    public MenuTree deserializeLenient(MenuDocument document) throws MenuFormatException {
        if (document == null) {
            throw new MenuFormatException("Empty menu document");
        }
        MenuTree tree = new MenuTree();
        if (document.getItems() != null) {
            buildChildren(document.getItems(), MenuTree.ROOT_ID, "", tree, new HashSet<>());
        }
        if (document.getNextId() != null) {
            tree.reserveIdsBelow(document.getNextId());
        }
        return tree;
    }

    private void buildChildren(List<MenuItemEntry> entries, long parentId, String parentPath, MenuTree tree,
                               Set<Long> seenIds) throws MenuFormatException {
        for (int i = 0; i < entries.size(); i++) {
            MenuItemEntry entry = entries.get(i);
            if (entry == null) {
                String slot = "[" + i + "]";
                throw new MenuFormatException(parentPath.isEmpty() ? slot : parentPath + MenuTree.PATH_DELIMITER + slot,
                    RuleViolation.UNKNOWN_KIND);
            }
            String self = entry.getLabel() != null && !entry.getLabel().isEmpty() ? entry.getLabel() : "[" + i + "]";
            String path = parentPath.isEmpty() ? self : parentPath + MenuTree.PATH_DELIMITER + self;

            MenuNode node = toNode(entry, path, seenIds);
            tree.append(node, parentId);
            if (node.isFolder() && entry.getChildren() != null) {
                buildChildren(entry.getChildren(), node.getId(), path, tree, seenIds);
            }
        }
    }

    private MenuNode toNode(MenuItemEntry entry, String path, Set<Long> seenIds) throws MenuFormatException {
        NodeKind kind = NodeKind.fromWireName(entry.getKind());
        if (kind == null) {
            throw new MenuFormatException(path, RuleViolation.UNKNOWN_KIND);
        }
        Long id = entry.getId();
        if (id == null || id <= MenuTree.ROOT_ID) {
            throw new MenuFormatException(path, RuleViolation.INVALID_ID);
        }
        if (!seenIds.add(id)) {
            throw new MenuFormatException(path, RuleViolation.DUPLICATE_ID);
        }
        if (!kind.canHaveChildren() && entry.getChildren() != null && !entry.getChildren().isEmpty()) {
            throw new MenuFormatException(path, RuleViolation.LEAF_HAS_CHILDREN);
        }
        CommandLanguage language = null;
        if (entry.getLanguage() != null) {
            language = CommandLanguage.fromWireName(entry.getLanguage());
            if (language == null) {
                throw new MenuFormatException(path, RuleViolation.UNKNOWN_LANGUAGE);
            }
        }
        NodeAttributes attributes = NodeAttributes.builder()
            .label(kind == NodeKind.SEPARATOR ? null : entry.getLabel())
            .iconRef(entry.getIcon())
            .language(language)
            .commandText(entry.getCommand())
            .optionBox(Boolean.TRUE.equals(entry.getOptionBox()))
            .build();
        Optional<RuleViolation> violation = LegalityValidator.checkAttributes(kind, attributes);
        if (violation.isPresent()) {
            throw new MenuFormatException(path, violation.get());
        }
        switch (kind) {
            case FOLDER:
                return new FolderNode(id, attributes.getLabel(), attributes.getIconRef());
            case COMMAND:
                return new CommandNode(id, attributes.getLabel(), language, attributes.getCommandText(),
                    attributes.getIconRef(), attributes.isOptionBox());
            default:
                return new SeparatorNode(id);
        }
    }

    public String writeString(MenuDocument document) throws JsonProcessingException {
        return objectMapper.writeValueAsString(document);
    }

    public MenuDocument readString(String json) throws MenuFormatException {
        try {
            MenuDocument document = objectMapper.readValue(json, MenuDocument.class);
            if (document == null) {
                throw new MenuFormatException("Empty menu document");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new MenuFormatException("Malformed menu document: " + e.getOriginalMessage(), e);
        }
    }

    public void write(MenuDocument document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, writeString(document), StandardCharsets.UTF_8);
    }

    public MenuDocument read(Path path) throws IOException, MenuFormatException {
        return readString(Files.readString(path, StandardCharsets.UTF_8));
    }
}
