package Engine;

/**
 * How much work the solving loop is asking for in the current check.
 */
public enum Effort {
    STANDARD,
    FULL,
    LAST_CALL
}
