package util.bril;

/**
 * Bril 加载器配置类
 *
 * Parse-time options controlling how the text is turned into control-flow
 * graphs.
 */
public class LoaderConfig {

    private boolean allowFallthrough = false;
    private boolean splitCriticalEdges = true;
    private boolean debugMode = false;
    private int maxErrors = 10;

    /**
     * 获取默认配置: strict fall-through, critical edges split
     */
    public static LoaderConfig defaultConfig() {
        return new LoaderConfig();
    }

    /**
     * 获取宽松配置: a block without terminator falls into the next one
     */
    public static LoaderConfig lenientConfig() {
        LoaderConfig config = new LoaderConfig();
        config.allowFallthrough = true;
        return config;
    }

    /**
     * 获取原样配置: keep the graph as written, no edge splitting
     */
    public static LoaderConfig rawConfig() {
        LoaderConfig config = new LoaderConfig();
        config.splitCriticalEdges = false;
        return config;
    }

    // Getters and Setters

    public boolean isAllowFallthrough() {
        return allowFallthrough;
    }

    public LoaderConfig setAllowFallthrough(boolean allowFallthrough) {
        this.allowFallthrough = allowFallthrough;
        return this;
    }

    public boolean isSplitCriticalEdges() {
        return splitCriticalEdges;
    }

    public LoaderConfig setSplitCriticalEdges(boolean splitCriticalEdges) {
        this.splitCriticalEdges = splitCriticalEdges;
        return this;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public LoaderConfig setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
        return this;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public LoaderConfig setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
        return this;
    }

    public LoaderConfig copy() {
        LoaderConfig copy = new LoaderConfig();
        copy.allowFallthrough = this.allowFallthrough;
        copy.splitCriticalEdges = this.splitCriticalEdges;
        copy.debugMode = this.debugMode;
        copy.maxErrors = this.maxErrors;
        return copy;
    }

    @Override
    public String toString() {
        return "LoaderConfig{" +
                "allowFallthrough=" + allowFallthrough +
                ", splitCriticalEdges=" + splitCriticalEdges +
                ", debugMode=" + debugMode +
                ", maxErrors=" + maxErrors +
                '}';
    }
}
