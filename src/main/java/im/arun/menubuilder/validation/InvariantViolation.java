package im.arun.menubuilder.validation;

import lombok.Value;

/**
 * A rule broken by a specific node, located by its path in the tree.
 */
@Value
public class InvariantViolation {
    long nodeId;
    String path;
    RuleViolation rule;

    @Override
    public String toString() {
        return path + ": " + rule.getDescription();
    }
}
