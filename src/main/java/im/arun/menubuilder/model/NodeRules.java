package im.arun.menubuilder.model;

/**
 * Side-effect free predicates over single nodes and their immediate neighbours.
 */
public final class NodeRules {

    private NodeRules() {}

    public static boolean canHaveChildren(NodeKind kind) {
        return kind != null && kind.canHaveChildren();
    }

    /**
     * An option-box must directly follow a plain command, which then acts as its
     * parent. Nodes that are not option-boxes are always placed validly.
     *
     * @param node             the node being placed
     * @param precedingSibling the sibling right before it, or null if it is first
     */
    public static boolean isValidOptionBoxPlacement(MenuNode node, MenuNode precedingSibling) {
        if (!node.isOptionBox()) {
            return true;
        }
        return precedingSibling != null
            && precedingSibling.isCommand()
            && !precedingSibling.isOptionBox();
    }
}
