package im.arun.menubuilder.engine;

import im.arun.menubuilder.model.MenuNode;
import im.arun.menubuilder.model.MenuTree;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeKind;
import lombok.Value;

/**
 * Read-only copy of a node as seen by callers outside the engine.
 */
@Value
public class NodeSnapshot {
    long id;
    NodeKind kind;
    long parentId;
    int index;
    String path;
    NodeAttributes attributes;

    static NodeSnapshot of(MenuTree tree, long id) {
        MenuNode node = tree.get(id);
        return new NodeSnapshot(id, node.getKind(), tree.parentOf(id), tree.indexOf(id), tree.pathOf(id),
            NodeAttributes.of(node));
    }

    public String getLabel() {
        return attributes.getLabel();
    }

    public boolean isOptionBox() {
        return attributes.isOptionBox();
    }
}
