package im.arun.menubuilder.model;

/**
 * Script language of a command's source text.
 */
public enum CommandLanguage {
    PYTHON("python"),
    MEL("mel");

    private final String wireName;

    CommandLanguage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CommandLanguage fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (CommandLanguage language : values()) {
            if (language.wireName.equalsIgnoreCase(name.trim())) {
                return language;
            }
        }
        return null;
    }
}
