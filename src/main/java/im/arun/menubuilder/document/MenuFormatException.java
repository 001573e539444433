package im.arun.menubuilder.document;

import im.arun.menubuilder.validation.RuleViolation;

/**
 * A menu document that is malformed or breaks a menu rule. Loading is aborted;
 * nothing is repaired.
 */
public class MenuFormatException extends Exception {

    private final String nodePath;
    private final RuleViolation rule;

    public MenuFormatException(String nodePath, RuleViolation rule) {
        super(nodePath + ": " + rule.getDescription());
        this.nodePath = nodePath;
        this.rule = rule;
    }

    public MenuFormatException(String message) {
        this(message, (Throwable) null);
    }

    /**
     * For documents that cannot be parsed at all.
     */
    public MenuFormatException(String message, Throwable cause) {
        super(message, cause);
        this.nodePath = null;
        this.rule = null;
    }

    /**
     * Location of the offending entry, or null when the document is not parseable.
     */
    public String getNodePath() {
        return nodePath;
    }

    /**
     * The broken rule, or null when the document is not parseable.
     */
    public RuleViolation getRule() {
        return rule;
    }
}
