package diagnostics;

/** Box edge on which tracing stopped. */
public enum Direction {
    TOP,
    RIGHT,
    BOTTOM,
    LEFT
}
