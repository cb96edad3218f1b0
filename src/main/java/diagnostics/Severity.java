package diagnostics;

public enum Severity {
    ERROR,   // parse fails
    WARNING  // reported next to a successful AST
}
