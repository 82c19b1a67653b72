package driver;

/*
 * configuration of the optimizer
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    // let LCM place computations on split critical edges
    public boolean lcmEdgePlacement = false;
    // accept blocks that fall into the next labeled block
    public boolean allowFallthrough = false;
    public boolean logToFile = false;

    private Config() {
        isDebug = getFlag("debug");
        lcmEdgePlacement = getFlag("lcm.edgePlacement");
        allowFallthrough = getFlag("fallthrough");
        logToFile = getFlag("log.file");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }
}
