package im.arun.menubuilder.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A submenu. Its children live in the owning {@link MenuTree}, not on the node.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class FolderNode extends MenuNode {

    private final String label;
    private final String iconRef;

    public FolderNode(long id, String label, String iconRef) {
        super(id);
        this.label = label;
        this.iconRef = iconRef;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOLDER;
    }

    @Override
    public FolderNode withId(long newId) {
        return new FolderNode(newId, label, iconRef);
    }
}
