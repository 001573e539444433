package im.arun.menubuilder.model;

import lombok.Value;

/**
 * A node that has not been placed in a tree yet, so it has no id. Manual
 * entry and the import adapters both produce drafts.
 */
@Value
public class NodeDraft {
    NodeKind kind;
    NodeAttributes attributes;

    public static NodeDraft folder(String label) {
        return new NodeDraft(NodeKind.FOLDER, NodeAttributes.builder().label(label).build());
    }

    public static NodeDraft command(String label, CommandLanguage language, String commandText) {
        return new NodeDraft(NodeKind.COMMAND, NodeAttributes.builder()
            .label(label)
            .language(language)
            .commandText(commandText)
            .build());
    }

    public static NodeDraft optionBox(String label, CommandLanguage language, String commandText) {
        return new NodeDraft(NodeKind.COMMAND, NodeAttributes.builder()
            .label(label)
            .language(language)
            .commandText(commandText)
            .optionBox(true)
            .build());
    }

    public static NodeDraft separator() {
        return new NodeDraft(NodeKind.SEPARATOR, NodeAttributes.builder().build());
    }

    public boolean isOptionBox() {
        return kind == NodeKind.COMMAND && attributes.isOptionBox();
    }

    /**
     * Materialize the draft under the given id.
     */
    public MenuNode toNode(long id) {
        switch (kind) {
            case FOLDER:
                return new FolderNode(id, attributes.getLabel(), attributes.getIconRef());
            case COMMAND:
                return new CommandNode(id, attributes.getLabel(), attributes.getLanguage(),
                    attributes.getCommandText(), attributes.getIconRef(), attributes.isOptionBox());
            case SEPARATOR:
                return new SeparatorNode(id);
            default:
                throw new IllegalStateException("Unknown node kind: " + kind);
        }
    }
}
