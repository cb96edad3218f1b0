package parser.shape;

import diagnostics.Diagnostic;
import model.Bounds;
import model.Box;
import model.Position;

import java.util.List;

/**
 * Outcome of tracing one corner: a box, or the problems found on its edges.
 * {@code corners} holds every corner the trace reached, so they are not
 * traced again as the start of another box.
 */
public record TraceResult(Box box, List<Diagnostic> diagnostics, List<Position> corners) {

    public TraceResult {
        diagnostics = List.copyOf(diagnostics);
        corners = List.copyOf(corners);
    }

    public static TraceResult ok(Box box) {
        Bounds b = box.bounds();
        return new TraceResult(box, List.of(), List.of(
                b.topLeft(), new Position(b.top(), b.right()),
                b.bottomRight(), new Position(b.bottom(), b.left())));
    }

    public static TraceResult failed(List<Diagnostic> diagnostics) {
        return new TraceResult(null, diagnostics, List.of());
    }

    public static TraceResult failed(List<Diagnostic> diagnostics, List<Position> corners) {
        return new TraceResult(null, diagnostics, corners);
    }

    public boolean isOk() {
        return box != null && diagnostics.isEmpty();
    }
}
