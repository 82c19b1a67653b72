package pass.IRPass.analysis.dataflow;

public enum Direction {
    FORWARD,
    BACKWARD
}
