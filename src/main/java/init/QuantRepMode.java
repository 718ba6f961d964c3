package init;

import java.util.Locale;

/**
 * How the internal representative of an equivalence class is chosen.
 */
public enum QuantRepMode {
    /** Use the equality engine's representative as is. */
    EE,
    /** Prefer the term that was chosen as a representative earliest. */
    FIRST,
    /** Prefer terms of smallest depth. */
    DEPTH;

    public static QuantRepMode fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Representative mode must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ee":
                return EE;
            case "first":
                return FIRST;
            case "depth":
                return DEPTH;
            default:
                throw new IllegalArgumentException("Unknown representative mode: " + name);
        }
    }
}
