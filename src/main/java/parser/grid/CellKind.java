package parser.grid;

public enum CellKind {
    CORNER,   // +
    HLINE,    // -
    VLINE,    // |
    DIVIDER,  // =
    SPACE,
    CHAR
}
