package parser.grid;

import model.Bounds;
import model.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Rectangular, read-only view of the input: every line padded with spaces to
 * the longest one, every cell classified, and the positions of the four
 * structural glyphs indexed once at construction.
 */
public final class Grid {

    private final Cell[][] cells;
    private final int width;
    private final int height;
    private final Map<CellKind, List<Position>> index = new EnumMap<>(CellKind.class);

    private Grid(Cell[][] cells, int width, int height) {
        this.cells = cells;
        this.width = width;
        this.height = height;
    }

    public static Grid fromText(String text) {
        if (text == null || text.isEmpty()) return fromLines(List.of());
        return fromLines(List.of(text.replace("\r\n", "\n").split("\n", -1)));
    }

    public static Grid fromLines(List<String> lines) {
        int maxWidth = 0;
        for (String line : lines) maxWidth = Math.max(maxWidth, line.length());

        int h = lines.size();
        Cell[][] cells = new Cell[h][maxWidth];
        Grid grid = new Grid(cells, maxWidth, h);
        List<Position> corners = new ArrayList<>();
        List<Position> hlines = new ArrayList<>();
        List<Position> vlines = new ArrayList<>();
        List<Position> dividers = new ArrayList<>();

        for (int r = 0; r < h; r++) {
            String line = lines.get(r);
            for (int c = 0; c < maxWidth; c++) {
                Cell cell = c < line.length() ? Cell.classify(line.charAt(c)) : Cell.SPACE;
                cells[r][c] = cell;
                switch (cell.kind()) {
                    case CORNER -> corners.add(new Position(r, c));
                    case HLINE -> hlines.add(new Position(r, c));
                    case VLINE -> vlines.add(new Position(r, c));
                    case DIVIDER -> dividers.add(new Position(r, c));
                    default -> { }
                }
            }
        }
        grid.index.put(CellKind.CORNER, Collections.unmodifiableList(corners));
        grid.index.put(CellKind.HLINE, Collections.unmodifiableList(hlines));
        grid.index.put(CellKind.VLINE, Collections.unmodifiableList(vlines));
        grid.index.put(CellKind.DIVIDER, Collections.unmodifiableList(dividers));
        return grid;
    }

    public int width()  { return width; }
    public int height() { return height; }

    public boolean inBounds(Position p) {
        return p.row() >= 0 && p.row() < height && p.col() >= 0 && p.col() < width;
    }

    public Optional<Cell> get(Position p) {
        return inBounds(p) ? Optional.of(cells[p.row()][p.col()]) : Optional.empty();
    }

    /** True when {@code p} is inside the grid and classified as {@code kind}. */
    public boolean is(Position p, CellKind kind) {
        return inBounds(p) && cells[p.row()][p.col()].kind() == kind;
    }

    /** Raw character at {@code p}; a space outside the grid. */
    public char charAt(Position p) {
        return inBounds(p) ? cells[p.row()][p.col()].ch() : ' ';
    }

    /** Characters of {@code row} between two columns, inclusive, clipped to the grid. */
    public String rowText(int row, int fromCol, int toCol) {
        if (row < 0 || row >= height) return "";
        int from = Math.max(0, fromCol);
        int to = Math.min(width - 1, toCol);
        StringBuilder sb = new StringBuilder(Math.max(0, to - from + 1));
        for (int c = from; c <= to; c++) sb.append(cells[row][c].ch());
        return sb.toString();
    }

    // ---- directional scans ----

    public List<ScanStep> scanRight(Position start, Predicate<Cell> keep) { return scan(start, 0, 1, keep); }
    public List<ScanStep> scanLeft(Position start, Predicate<Cell> keep)  { return scan(start, 0, -1, keep); }
    public List<ScanStep> scanDown(Position start, Predicate<Cell> keep)  { return scan(start, 1, 0, keep); }
    public List<ScanStep> scanUp(Position start, Predicate<Cell> keep)    { return scan(start, -1, 0, keep); }

    private List<ScanStep> scan(Position start, int dRow, int dCol, Predicate<Cell> keep) {
        List<ScanStep> out = new ArrayList<>();
        int r = start.row();
        int c = start.col();
        while (r >= 0 && r < height && c >= 0 && c < width) {
            Cell cell = cells[r][c];
            if (!keep.test(cell)) break;
            out.add(new ScanStep(new Position(r, c), cell));
            r += dRow;
            c += dCol;
        }
        return out;
    }

    // ---- index lookups ----

    public List<Position> findAll(CellKind kind) {
        return index.getOrDefault(kind, List.of());
    }

    public List<Position> findInRange(CellKind kind, Bounds bounds) {
        List<Position> out = new ArrayList<>();
        for (Position p : findAll(kind)) {
            if (bounds.containsPosition(p)) out.add(p);
        }
        return out;
    }

    /** One cell visited by a directional scan. */
    public record ScanStep(Position position, Cell cell) {}
}
