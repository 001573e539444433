package im.arun.menubuilder.model;

import lombok.Builder;
import lombok.Value;

/**
 * The user-editable attributes of a node. Which of them are meaningful depends
 * on the node kind: folders take a label and icon, commands take everything,
 * separators take nothing.
 */
@Value
@Builder(toBuilder = true)
public class NodeAttributes {
    String label;
    String iconRef;
    CommandLanguage language;
    String commandText;
    boolean optionBox;

    public static NodeAttributes of(MenuNode node) {
        if (node instanceof CommandNode) {
            CommandNode command = (CommandNode) node;
            return NodeAttributes.builder()
                .label(command.getLabel())
                .iconRef(command.getIconRef())
                .language(command.getLanguage())
                .commandText(command.getCommandText())
                .optionBox(command.isOptionBox())
                .build();
        }
        if (node instanceof FolderNode) {
            FolderNode folder = (FolderNode) node;
            return NodeAttributes.builder()
                .label(folder.getLabel())
                .iconRef(folder.getIconRef())
                .build();
        }
        return NodeAttributes.builder().build();
    }

    public boolean hasCommandData() {
        return language != null || (commandText != null && !commandText.isEmpty());
    }

    public boolean hasLabel() {
        return label != null && !label.trim().isEmpty();
    }
}
