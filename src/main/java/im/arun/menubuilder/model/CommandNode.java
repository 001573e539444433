package im.arun.menubuilder.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An actionable menu entry carrying script source for the host to execute.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class CommandNode extends MenuNode {

    private final String label;
    private final CommandLanguage language;
    private final String commandText;
    private final String iconRef;
    private final boolean optionBox;

    public CommandNode(long id, String label, CommandLanguage language, String commandText,
                       String iconRef, boolean optionBox) {
        super(id);
        this.label = label;
        this.language = language != null ? language : CommandLanguage.PYTHON;
        this.commandText = commandText != null ? commandText : "";
        this.iconRef = iconRef;
        this.optionBox = optionBox;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMMAND;
    }

    @Override
    public boolean isOptionBox() {
        return optionBox;
    }

    @Override
    public CommandNode withId(long newId) {
        return new CommandNode(newId, label, language, commandText, iconRef, optionBox);
    }

    public CommandNode withOptionBox(boolean enabled) {
        return new CommandNode(getId(), label, language, commandText, iconRef, enabled);
    }
}
