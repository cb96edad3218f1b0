package parser.shape;

import model.Bounds;
import model.Position;
import parser.grid.CellKind;
import parser.grid.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Finds interior rows of a box that are entirely made of '='. */
public final class DividerDetector {
    private DividerDetector() {}

    /** Divider rows of {@code box}, top to bottom. A partial '=' run is not a divider. */
    public static List<Integer> detect(Grid grid, Bounds box) {
        int interiorWidth = box.right() - box.left() - 1;
        if (interiorWidth <= 0 || box.bottom() - box.top() < 2) return List.of();

        Bounds interior = new Bounds(box.top() + 1, box.left() + 1, box.bottom() - 1, box.right() - 1);
        Map<Integer, Integer> perRow = new TreeMap<>();
        for (Position p : grid.findInRange(CellKind.DIVIDER, interior)) {
            perRow.merge(p.row(), 1, Integer::sum);
        }

        List<Integer> rows = new ArrayList<>();
        for (Map.Entry<Integer, Integer> e : perRow.entrySet()) {
            if (e.getValue() == interiorWidth) rows.add(e.getKey());
        }
        return rows;
    }
}
