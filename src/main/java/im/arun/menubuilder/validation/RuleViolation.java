package im.arun.menubuilder.validation;

/**
 * Why a structural operation or a document was rejected.
 */
public enum RuleViolation {
    INVALID_OPTION_BOX_POSITION("an option-box must directly follow a command that is not itself an option-box"),
    OPTION_BOX_PAIR_SPLIT("nothing may be placed between a command and its option-box"),
    OPTION_BOX_REQUIRES_COMMAND("only commands can be option-boxes"),
    PARENT_MUST_BE_FOLDER("only folders can hold children"),
    CYCLIC_MOVE("a node cannot be moved into itself or its own descendants"),
    EDIT_IN_PROGRESS("another edit is in progress"),
    NOT_EDITING("no edit is in progress"),
    NOT_EDITABLE("separators have no editable attributes"),
    NOT_FOUND("no node with that id"),
    INDEX_OUT_OF_RANGE("position is outside the parent's children"),
    MISSING_LABEL("folders and commands need a label"),
    ATTRIBUTE_NOT_ALLOWED("attribute not allowed for this kind of node"),
    DUPLICATE_FOLDER_LABEL("a folder with that label already exists here"),
    DUPLICATE_ID("node id is used more than once"),
    INVALID_ID("node ids must be positive"),
    UNKNOWN_KIND("unknown node kind"),
    UNKNOWN_LANGUAGE("unknown command language"),
    LEAF_HAS_CHILDREN("only folders can have children");

    private final String description;

    RuleViolation(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
