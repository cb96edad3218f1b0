package parser.grid;

/** One classified grid character. Classification depends on the character only. */
public record Cell(CellKind kind, char ch) {

    public static final Cell SPACE = new Cell(CellKind.SPACE, ' ');

    private static final Cell CORNER  = new Cell(CellKind.CORNER, '+');
    private static final Cell HLINE   = new Cell(CellKind.HLINE, '-');
    private static final Cell VLINE   = new Cell(CellKind.VLINE, '|');
    private static final Cell DIVIDER = new Cell(CellKind.DIVIDER, '=');

    public static Cell classify(char c) {
        return switch (c) {
            case '+' -> CORNER;
            case '-' -> HLINE;
            case '|' -> VLINE;
            case '=' -> DIVIDER;
            case ' ' -> SPACE;
            default -> new Cell(CellKind.CHAR, c);
        };
    }

    public boolean is(CellKind k) {
        return kind == k;
    }
}
