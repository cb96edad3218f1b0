package parser.shape;

import diagnostics.Diagnostic;
import model.Box;
import model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parser.grid.CellKind;
import parser.grid.Grid;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Traces every box in a grid and builds their hierarchy. */
public final class ShapeDetector {

    private static final Logger log = LoggerFactory.getLogger(ShapeDetector.class);

    private final HierarchyBuilder hierarchyBuilder;

    public ShapeDetector() {
        this(new HierarchyBuilder());
    }

    public ShapeDetector(HierarchyBuilder hierarchyBuilder) {
        this.hierarchyBuilder = hierarchyBuilder;
    }

    public Shapes detect(Grid grid) {
        BoxTracer tracer = new BoxTracer(grid);
        List<Box> traced = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        // corners reached by earlier traces, failed ones included
        Set<Position> claimed = new HashSet<>();

        for (Position corner : grid.findAll(CellKind.CORNER)) {
            if (claimed.contains(corner) || !tracer.isTopLeftCandidate(corner)) continue;
            TraceResult r = tracer.traceBox(corner);
            claimed.addAll(r.corners());
            if (r.isOk()) {
                traced.add(r.box());
            } else {
                diagnostics.addAll(r.diagnostics());
            }
        }
        log.debug("Traced {} boxes, {} failed edges", traced.size(), diagnostics.size());

        HierarchyBuilder.Result h = hierarchyBuilder.build(traced);
        diagnostics.addAll(h.errors());
        diagnostics.addAll(h.warnings());
        return new Shapes(h.roots(), diagnostics);
    }

    /** Root boxes (children attached) plus every diagnostic from tracing and nesting. */
    public record Shapes(List<Box> roots, List<Diagnostic> diagnostics) {
        public Shapes {
            roots = List.copyOf(roots);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
