package util.logging;

/**
 * Log levels, from most to least verbose
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if messages at this level are filtered out by a logger set
     *         to {@code other}
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return this.value < other.value;
    }
}
