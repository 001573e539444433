package im.arun.menubuilder.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Edit-mode of the structure engine: either idle, or editing exactly one node.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EditState {

    public static final EditState IDLE = new EditState(null);

    Long nodeId;

    public static EditState editing(long nodeId) {
        return new EditState(nodeId);
    }

    public boolean isIdle() {
        return nodeId == null;
    }

    public boolean isEditing(long id) {
        return nodeId != null && nodeId == id;
    }

    @Override
    public String toString() {
        return isIdle() ? "Idle" : "Editing(" + nodeId + ")";
    }
}
