package im.arun.menubuilder.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a function name or command string into a readable menu label,
 * e.g. {@code my_awesome_tool} to "My Awesome Tool" or {@code cmds.polySphere}
 * to "Poly Sphere".
 */
public final class LabelGenerator {

    private static final Pattern CMDS_PREFIX = Pattern.compile("^cmds\\.");
    private static final Pattern ENTRY_POINT_SUFFIX = Pattern.compile("\\.(main|run|execute)\\s*\\(\\)\\s*$");
    private static final Pattern IMPORT_THEN_CALL = Pattern.compile("import\\s+(\\w+);\\s*\\1");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");

    private LabelGenerator() {}

    public static String fromCommand(String command) {
        if (command == null) {
            return "";
        }
        String core = CMDS_PREFIX.matcher(command.trim()).replaceFirst("");
        core = ENTRY_POINT_SUFFIX.matcher(core).replaceFirst("");

        Matcher importThenCall = IMPORT_THEN_CALL.matcher(core);
        if (importThenCall.find()) {
            core = importThenCall.group(1);
        }

        String spaced = CAMEL_BOUNDARY.matcher(core.replace('_', ' ')).replaceAll("$1 $2");

        List<String> words = new ArrayList<>();
        for (String word : spaced.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(Character.toUpperCase(word.charAt(0)) + word.substring(1).toLowerCase());
            }
        }
        return String.join(" ", words);
    }
}
