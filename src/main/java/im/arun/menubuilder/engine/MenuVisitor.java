package im.arun.menubuilder.engine;

import im.arun.menubuilder.model.CommandNode;
import im.arun.menubuilder.model.FolderNode;
import im.arun.menubuilder.model.SeparatorNode;

/**
 * Read-only, order-preserving walk over a validated menu tree, as consumed by
 * a menu renderer. Option-boxes are not visited on their own; they arrive
 * attached to the command they belong to.
 */
public interface MenuVisitor {

    void enterFolder(FolderNode folder, int depth);

    void exitFolder(FolderNode folder, int depth);

    /**
     * @param optionBox the option-box attached to this command, or null
     */
    void visitCommand(CommandNode command, CommandNode optionBox, int depth);

    void visitSeparator(SeparatorNode separator, int depth);
}
