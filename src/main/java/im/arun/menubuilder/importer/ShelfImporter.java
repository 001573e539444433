package im.arun.menubuilder.importer;

import im.arun.menubuilder.model.CommandLanguage;
import im.arun.menubuilder.model.NodeAttributes;
import im.arun.menubuilder.model.NodeDraft;
import im.arun.menubuilder.model.NodeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Reads a saved shelf script ({@code shelf_<name>.mel}) and turns each
 * {@code shelfButton} into a command draft, keeping shelf order. Buttons with
 * no command are skipped. Nothing is inserted into a tree here.
 */
public class ShelfImporter {

    private static final String SHELF_BUTTON = "shelfButton";

    public List<NodeDraft> importLegacyShelf(String shelfSource) {
        List<NodeDraft> drafts = new ArrayList<>();
        if (shelfSource == null || shelfSource.isEmpty()) {
            return drafts;
        }
        List<Token> tokens = tokenize(shelfSource);
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.quoted || !SHELF_BUTTON.equals(token.text)) {
                continue;
            }
            Map<String, String> flags = new HashMap<>();
            i = readFlags(tokens, i + 1, flags);
            NodeDraft draft = toDraft(flags);
            if (draft != null) {
                drafts.add(draft);
            }
        }
        return drafts;
    }

    /**
     * Collect {@code -flag value} pairs up to the terminating semicolon.
     *
     * @return index of the terminating token
     */
    private int readFlags(List<Token> tokens, int start, Map<String, String> flags) {
        int i = start;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (!token.quoted && ";".equals(token.text)) {
                return i;
            }
            if (token.isFlag()) {
                String name = token.text.substring(1);
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                if (next != null && !next.isFlag() && !(!next.quoted && ";".equals(next.text))) {
                    flags.putIfAbsent(name, next.text);
                    i++;
                }
            }
            i++;
        }
        return i;
    }

    private NodeDraft toDraft(Map<String, String> flags) {
        String command = firstOf(flags, "command", "c");
        if (command == null || command.trim().isEmpty()) {
            return null;
        }
        // shelf buttons default to MEL when no source type is given
        String sourceType = firstOf(flags, "sourceType", "stp");
        CommandLanguage language = "python".equalsIgnoreCase(sourceType) ? CommandLanguage.PYTHON : CommandLanguage.MEL;

        String label = firstOf(flags, "label", "l");
        if (isBlank(label)) {
            label = firstOf(flags, "annotation", "ann");
        }
        if (isBlank(label)) {
            label = LabelGenerator.fromCommand(command.trim().split("\\R")[0]);
        }
        String icon = firstOf(flags, "image1", "i1");
        if (isBlank(icon)) {
            icon = firstOf(flags, "image", "i");
        }

        return new NodeDraft(NodeKind.COMMAND, NodeAttributes.builder()
            .label(label.trim())
            .language(language)
            .commandText(command)
            .iconRef(isBlank(icon) ? null : icon)
            .build());
    }

    private static String firstOf(Map<String, String> flags, String longName, String shortName) {
        String value = flags.get(longName);
        return value != null ? value : flags.get(shortName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Shelf import cancelled");
            }
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '/' && i + 1 < length && source.charAt(i + 1) == '/') {
                while (i < length && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '"') {
                StringBuilder text = new StringBuilder();
                i++;
                while (i < length && source.charAt(i) != '"') {
                    char ch = source.charAt(i);
                    if (ch == '\\' && i + 1 < length) {
                        text.append(unescape(source.charAt(i + 1)));
                        i += 2;
                    } else {
                        text.append(ch);
                        i++;
                    }
                }
                i++;
                tokens.add(new Token(text.toString(), true));
            } else if (c == ';' || c == '{' || c == '}' || c == '(' || c == ')') {
                tokens.add(new Token(String.valueOf(c), false));
                i++;
            } else {
                int start = i;
                while (i < length && !Character.isWhitespace(source.charAt(i)) && "\";{}()".indexOf(source.charAt(i)) < 0) {
                    i++;
                }
                tokens.add(new Token(source.substring(start, i), false));
            }
        }
        return tokens;
    }

    private static char unescape(char escaped) {
        switch (escaped) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                return escaped;
        }
    }

    private static final class Token {
        private final String text;
        private final boolean quoted;

        private Token(String text, boolean quoted) {
            this.text = text;
            this.quoted = quoted;
        }

        private boolean isFlag() {
            return !quoted && text.length() > 1 && text.charAt(0) == '-' && Character.isLetter(text.charAt(1));
        }
    }
}
