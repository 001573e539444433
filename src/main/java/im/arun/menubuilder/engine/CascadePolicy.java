package im.arun.menubuilder.engine;

/**
 * What happens to an option-box when the command it is attached to is deleted.
 */
public enum CascadePolicy {
    /** Keep the option-box as an ordinary command. */
    DEMOTE,
    /** Delete the option-box together with its parent command. */
    DELETE;

    public static final CascadePolicy DEFAULT = DEMOTE;
}
