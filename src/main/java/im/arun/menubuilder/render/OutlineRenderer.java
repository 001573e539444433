package im.arun.menubuilder.render;

import im.arun.menubuilder.engine.MenuStructureEngine;
import im.arun.menubuilder.engine.MenuVisitor;
import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.SeparatorNode;

/**
 * Renders a menu as an indented text outline. Folders become submenus,
 * commands become entries with their option-box shown as {@value #OPTION_BOX_MARK},
 * separators become divider lines.
 */
public class OutlineRenderer implements MenuVisitor {

    public static final String OPTION_BOX_MARK = "[□]";
    static final String DIVIDER = "--------";
    private static final String INDENT = "  ";

    private final StringBuilder output = new StringBuilder();

    /**
     * Render the engine's current tree, replacing anything rendered before.
     */
    public String render(MenuStructureEngine engine) {
        output.setLength(0);
        engine.traverse(this);
        return output.toString();
    }

    @Override
    public void enterFolder(FolderNode folder, int depth) {
        line(depth, folder.getLabel() + " >");
    }

    @Override
    public void exitFolder(FolderNode folder, int depth) {
        // submenus close implicitly in an outline
    }

    @Override
    public void visitCommand(CommandNode command, CommandNode optionBox, int depth) {
        String text = command.getLabel();
        if (optionBox != null) {
            text += " " + OPTION_BOX_MARK;
        }
        line(depth, text);
    }

    @Override
    public void visitSeparator(SeparatorNode separator, int depth) {
        line(depth, DIVIDER);
    }

    private void line(int depth, String text) {
        for (int i = 0; i < depth; i++) {
            output.append(INDENT);
        }
        output.append(text).append('\n');
    }
}
