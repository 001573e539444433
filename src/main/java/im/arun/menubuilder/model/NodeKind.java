package im.arun.menubuilder.model;

/**
 * The three kinds of menu entry. Kind is fixed when a node is created.
 */
public enum NodeKind {
    FOLDER("folder"),
    COMMAND("command"),
    SEPARATOR("separator");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean canHaveChildren() {
        return this == FOLDER;
    }

    public boolean requiresLabel() {
        return this != SEPARATOR;
    }

    /**
     * Resolve a persisted kind name, case-insensitively.
     *
     * @return the kind, or null if the name is unknown
     */
    public static NodeKind fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (NodeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name.trim())) {
                return kind;
            }
        }
        return null;
    }
}
