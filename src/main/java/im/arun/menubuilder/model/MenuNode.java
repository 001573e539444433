package im.arun.menubuilder.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry in a menu tree. Subclasses are immutable; a change produces a new
 * instance with the same id, which {@link MenuTree#replace(MenuNode)} swaps in.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class MenuNode {

    private final long id;

    protected MenuNode(long id) {
        this.id = id;
    }

    public abstract NodeKind getKind();

    /**
     * Display text, or null for separators.
     */
    public abstract String getLabel();

    /**
     * Same node under another id. Used when a merge has to re-key a colliding entry.
     */
    public abstract MenuNode withId(long newId);

    public boolean isFolder() {
        return getKind() == NodeKind.FOLDER;
    }

    public boolean isCommand() {
        return getKind() == NodeKind.COMMAND;
    }

    public boolean isSeparator() {
        return getKind() == NodeKind.SEPARATOR;
    }

    /**
     * True only for a command flagged as an option-box.
     */
    public boolean isOptionBox() {
        return false;
    }
}
