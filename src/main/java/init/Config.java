package init;

import java.util.Properties;

public class Config {

    // Representative selection
    public static String quantRepMode = "first";   // ee | first | depth
    public static boolean lteRestrictInstClosure = false;

    // Instantiation levels
    public static int instMaxLevel = -1;           // -1 means no maximum
    public static boolean instLevelInputOnly = true;

    // Other quantifier strategies the selection must respect
    public static boolean cbqi = false;
    public static boolean finiteModelFind = false;

    /**
     * Overrides the defaults above from {@code quant.*} keys. Unknown keys are ignored.
     */
    public static void apply(Properties props) {
        // read and validate everything first, nothing changes if one value is bad
        String mode = props.getProperty("quant.repMode", quantRepMode).trim();
        QuantRepMode.fromString(mode);
        boolean restrict = readBoolean(props, "quant.restrictInstClosure", lteRestrictInstClosure);
        int maxLevel = readInt(props, "quant.instMaxLevel", instMaxLevel);
        boolean inputOnly = readBoolean(props, "quant.instLevelInputOnly", instLevelInputOnly);
        boolean useCbqi = readBoolean(props, "quant.cbqi", cbqi);
        boolean fmf = readBoolean(props, "quant.finiteModelFind", finiteModelFind);
        if (maxLevel < -1) {
            throw new IllegalArgumentException("quant.instMaxLevel must be -1 or non-negative: " + maxLevel);
        }

        quantRepMode = mode;
        lteRestrictInstClosure = restrict;
        instMaxLevel = maxLevel;
        instLevelInputOnly = inputOnly;
        cbqi = useCbqi;
        finiteModelFind = fmf;
    }

    public static void restoreDefaults() {
        quantRepMode = "first";
        lteRestrictInstClosure = false;
        instMaxLevel = -1;
        instLevelInputOnly = true;
        cbqi = false;
        finiteModelFind = false;
    }

    private static boolean readBoolean(Properties props, String key, boolean current) {
        String value = props.getProperty(key);
        if (value == null) {
            return current;
        }
        value = value.trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Expected true/false for " + key + ": " + value);
    }

    private static int readInt(Properties props, String key, int current) {
        String value = props.getProperty(key);
        if (value == null) {
            return current;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer for " + key + ": " + value, e);
        }
    }
}
