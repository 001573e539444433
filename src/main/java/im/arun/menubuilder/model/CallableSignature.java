package im.arun.menubuilder.model;

import lombok.Value;

/**
 * A callable found in a script file, offered as a candidate menu command.
 */
@Value
public class CallableSignature {
    String name;
    CommandLanguage language;
    int lineNumber;
    String suggestedLabel;
}
