package parser.shape;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import diagnostics.Direction;
import model.Bounds;
import model.Box;
import model.Position;
import parser.grid.Cell;
import parser.grid.CellKind;
import parser.grid.Grid;
import parser.grid.Grid.ScanStep;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks the four edges of a box from its top-left corner:
 * top (rightwards), right (downwards), bottom (leftwards), left (upwards).
 * Every problem met on the way is collected; a box with any problem is
 * reported as failed.
 */
public final class BoxTracer {

    /** How far from its column a border pipe may drift and still be recognised as misplaced. */
    static final int MAX_PIPE_DRIFT = 3;

    private static final Predicate<Cell> TOP_EDGE =
            c -> c.is(CellKind.HLINE) || c.is(CellKind.CHAR) || c.is(CellKind.SPACE);
    private static final Predicate<Cell> BOTTOM_EDGE =
            c -> c.is(CellKind.HLINE) || c.is(CellKind.DIVIDER);
    private static final Predicate<Cell> PIPE = c -> c.is(CellKind.VLINE);

    private final Grid grid;

    public BoxTracer(Grid grid) {
        this.grid = grid;
    }

    /**
     * A corner starts a box when no pipe sits above it and either a dash
     * follows it, or a box name follows it with a border below.
     * A {@code +} inside text such as {@code 1+1} has no border below it.
     */
    public boolean isTopLeftCandidate(Position p) {
        if (!grid.is(p, CellKind.CORNER) || grid.is(p.up(), CellKind.VLINE)) return false;
        if (grid.is(p.right(), CellKind.HLINE)) return true;
        return grid.is(p.right(), CellKind.CHAR)
                && (grid.is(p.down(), CellKind.VLINE) || grid.is(p.down(), CellKind.CORNER));
    }

    public TraceResult traceBox(Position start) {
        if (!grid.is(start, CellKind.CORNER)) {
            throw new IllegalArgumentException("Not a corner: " + start);
        }
        List<Diagnostic> diags = new ArrayList<>();

        // top
        List<ScanStep> top = grid.scanRight(start.right(), TOP_EDGE);
        Position topRight = start.right(top.size() + 1);
        if (!grid.is(topRight, CellKind.CORNER)) {
            return TraceResult.failed(List.of(DiagnosticFactory.unclosedBox(start, Direction.TOP)));
        }
        String name = extractName(top);

        // right
        List<Diagnostic> rightDiags = new ArrayList<>();
        Position bottomRight = walkDown(topRight, start.col(), rightDiags);
        if (bottomRight == null) {
            return TraceResult.failed(List.of(diagnoseOpenRightEdge(start, topRight)));
        }
        diags.addAll(rightDiags);

        // bottom
        List<ScanStep> bottom = grid.scanLeft(bottomRight.left(), BOTTOM_EDGE);
        Position bottomLeft = bottomRight.left(bottom.size() + 1);
        if (!grid.is(bottomLeft, CellKind.CORNER)) {
            diags.add(DiagnosticFactory.unclosedBox(start, Direction.BOTTOM));
            return TraceResult.failed(diags, List.of(start, topRight, bottomRight));
        }

        int topWidth = topRight.col() - start.col();
        int bottomWidth = bottomRight.col() - bottomLeft.col();
        if (topWidth != bottomWidth) {
            diags.add(DiagnosticFactory.mismatchedWidth(start, bottomLeft, topWidth, bottomWidth));
        }

        // left, back up to the start row
        for (int r = bottomRight.row() - 1; r > start.row(); r--) {
            Position p = new Position(r, start.col());
            if (grid.is(p, CellKind.VLINE)) continue;
            int actual = nearestPipe(r, start.col(), start.col() - MAX_PIPE_DRIFT - 1, bottomRight.col());
            if (actual < 0) {
                diags.add(DiagnosticFactory.unclosedBox(start, Direction.LEFT));
                break;
            }
            diags.add(DiagnosticFactory.misalignedPipe(r, start.col(), actual));
        }

        if (!diags.isEmpty()) {
            return TraceResult.failed(diags, List.of(start, topRight, bottomRight, bottomLeft));
        }
        return TraceResult.ok(new Box(name, Bounds.of(start, bottomRight)));
    }

    /**
     * Follows the right border down from {@code topRight}. Returns the
     * bottom-right corner, or null when the border runs out first.
     */
    private Position walkDown(Position topRight, int leftCol, List<Diagnostic> out) {
        int col = topRight.col();
        for (int r = topRight.row() + 1; r < grid.height(); r++) {
            Position p = new Position(r, col);
            if (grid.is(p, CellKind.CORNER)) return p;
            if (grid.is(p, CellKind.VLINE)) continue;
            int actual = nearestPipe(r, col, leftCol, grid.width());
            if (actual < 0) return null;
            out.add(DiagnosticFactory.misalignedPipe(r, col, actual));
        }
        return null;
    }

    /**
     * The right border never reached a corner. Look at the bottom from the
     * left side to tell a short or long bottom border apart from a broken
     * right one.
     */
    private Diagnostic diagnoseOpenRightEdge(Position start, Position topRight) {
        List<ScanStep> left = grid.scanDown(start.down(), PIPE);
        Position bottomLeft = start.down(left.size() + 1);
        if (!grid.is(bottomLeft, CellKind.CORNER)) {
            return DiagnosticFactory.unclosedBox(start, Direction.RIGHT);
        }
        List<ScanStep> bottom = grid.scanRight(bottomLeft.right(), BOTTOM_EDGE);
        Position end = bottomLeft.right(bottom.size() + 1);
        if (!grid.is(end, CellKind.CORNER)) {
            return DiagnosticFactory.unclosedBox(start, Direction.BOTTOM);
        }
        if (end.col() != topRight.col()) {
            return DiagnosticFactory.mismatchedWidth(start, bottomLeft,
                    topRight.col() - start.col(), end.col() - bottomLeft.col());
        }
        return DiagnosticFactory.unclosedBox(start, Direction.RIGHT);
    }

    /** Closest pipe to {@code col} on {@code row}, strictly between the two limits; -1 if none. */
    private int nearestPipe(int row, int col, int lowerLimit, int upperLimit) {
        for (int d = 1; d <= MAX_PIPE_DRIFT; d++) {
            int before = col - d;
            if (before > lowerLimit && grid.is(new Position(row, before), CellKind.VLINE)) return before;
            int after = col + d;
            if (after < upperLimit && grid.is(new Position(row, after), CellKind.VLINE)) return after;
        }
        return -1;
    }

    static String extractName(List<ScanStep> topEdge) {
        boolean hasText = false;
        StringBuilder sb = new StringBuilder();
        for (ScanStep s : topEdge) {
            sb.append(s.cell().ch());
            if (s.cell().is(CellKind.CHAR)) hasText = true;
        }
        if (!hasText) return null;
        String name = sb.toString().replaceAll("^-+", "").replaceAll("-+$", "").trim();
        return name.isEmpty() ? null : name;
    }
}
