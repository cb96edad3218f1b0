package parser.shape;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import model.Bounds;
import model.Box;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a flat list of traced boxes into a containment forest.
 *
 * <p>Boxes are kept in an index arena: parents are resolved into
 * {@code parentOf}/{@code childrenOf} tables first and the immutable tree is
 * materialised afterwards. The parent of a box is the smallest box that
 * strictly contains it. Pairs that neither nest nor stay apart are rejected.
 */
public final class HierarchyBuilder {

    public static final int DEFAULT_MAX_DEPTH = 4;

    private final int maxDepth;

    public HierarchyBuilder() {
        this(DEFAULT_MAX_DEPTH);
    }

    public HierarchyBuilder(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public Result build(List<Box> boxes) {
        int n = boxes.size();
        Bounds[] bounds = new Bounds[n];
        for (int i = 0; i < n; i++) bounds[i] = boxes.get(i).bounds();

        // larger boxes first; List.sort is stable so ties keep trace order
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        order.sort(Comparator.comparingInt((Integer i) -> bounds[i].area()).reversed());

        int[] parentOf = new int[n];
        Arrays.fill(parentOf, -1);
        List<List<Integer>> childrenOf = new ArrayList<>(n);
        for (int i = 0; i < n; i++) childrenOf.add(new ArrayList<>());

        for (int b : order) {
            int best = -1;
            for (int p : order) {
                if (p == b || !bounds[p].contains(bounds[b])) continue;
                if (best < 0 || bounds[p].area() < bounds[best].area()) best = p;
            }
            parentOf[b] = best;
            if (best >= 0) childrenOf.get(best).add(b);
        }

        List<Diagnostic> errors = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                Bounds a = bounds[i];
                Bounds c = bounds[j];
                if (a.contains(c) || c.contains(a) || !a.overlaps(c)) continue;
                errors.add(DiagnosticFactory.overlappingBoxes(a, c));
            }
        }
        if (!errors.isEmpty()) {
            return new Result(List.of(), errors, List.of());
        }

        List<Box> roots = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (int i : order) {
            if (parentOf[i] >= 0) continue;
            Box root = materialize(i, boxes, childrenOf);
            roots.add(root);
            int depth = root.depth();
            if (depth > maxDepth) {
                warnings.add(DiagnosticFactory.deepNesting(root.bounds().topLeft(), depth));
            }
        }
        return new Result(roots, List.of(), warnings);
    }

    private static Box materialize(int i, List<Box> boxes, List<List<Integer>> childrenOf) {
        List<Box> children = new ArrayList<>();
        for (int c : childrenOf.get(i)) children.add(materialize(c, boxes, childrenOf));
        return boxes.get(i).withChildren(children);
    }

    public record Result(List<Box> roots, List<Diagnostic> errors, List<Diagnostic> warnings) {
        public Result {
            roots = List.copyOf(roots);
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isOk() {
            return errors.isEmpty();
        }
    }
}
