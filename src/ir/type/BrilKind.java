package ir.type;

public enum BrilKind {
    INT,
    BOOL,
    POINTER
}
