package parser.semantic;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import model.Alignment;
import model.Bounds;
import model.Box;
import model.Element;
import model.Position;
import model.Scene;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parser.grid.Grid;
import parser.semantic.elements.InputParser;
import parser.semantic.elements.ParserRegistry;
import parser.shape.DividerDetector;
import parser.shape.ShapeDetector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds one scene from its block: detects boxes, reads every interior row
 * that no child box owns, and groups side-by-side boxes into rows.
 * Element positions and diagnostics are reported in file coordinates.
 */
public final class SemanticParser {

    private static final Logger log = LoggerFactory.getLogger(SemanticParser.class);

    private static final Pattern EMPTY_BRACKETS = Pattern.compile("^\\[\\s*\\]$");

    private final ParserRegistry registry;
    private final ShapeDetector shapeDetector;

    public SemanticParser() {
        this(new ParserRegistry(), new ShapeDetector());
    }

    public SemanticParser(ParserRegistry registry, ShapeDetector shapeDetector) {
        this.registry = registry;
        this.shapeDetector = shapeDetector;
    }

    public SceneResult parse(SceneBlock block) {
        Grid grid = Grid.fromLines(block.lines());
        int offset = block.lineOffset();
        List<Diagnostic> diags = new ArrayList<>();

        ShapeDetector.Shapes shapes = shapeDetector.detect(grid);
        for (Diagnostic d : shapes.diagnostics()) diags.add(d.shift(offset));

        List<Box> roots = new ArrayList<>(shapes.roots());
        roots.sort(Comparator.comparingInt((Box b) -> b.bounds().top()).thenComparingInt(b -> b.bounds().left()));

        List<Element> elements = new ArrayList<>();
        for (Box root : roots) elements.add(parseBox(grid, root, offset, diags));

        // scene roots are grouped against the whole width of the block
        Bounds page = new Bounds(offset, -1, offset + Math.max(0, grid.height() - 1), grid.width());
        elements = groupRows(elements, page);

        log.debug("Scene '{}': {} root elements, {} diagnostics", block.id(), elements.size(), diags.size());
        Scene scene = new Scene(block.id(), block.title(), block.transition(), block.device(), elements);
        return new SceneResult(scene, diags);
    }

    private Element parseBox(Grid grid, Box box, int offset, List<Diagnostic> diags) {
        Bounds b = box.bounds();
        Bounds fileBounds = b.shift(offset);
        Set<Integer> dividers = new HashSet<>(DividerDetector.detect(grid, b));

        List<Placed> placed = new ArrayList<>();
        for (int r = b.top() + 1; r < b.bottom(); r++) {
            if (ownedByChild(box, r)) continue;
            Position rowStart = new Position(r + offset, b.left() + 1);
            if (dividers.contains(r)) {
                placed.add(new Placed(r, b.left() + 1, new Element.Divider(rowStart)));
                continue;
            }
            String interior = grid.rowText(r, b.left() + 1, b.right() - 1);
            String content = interior.strip();
            if (content.isEmpty()) {
                placed.add(new Placed(r, b.left() + 1, new Element.Spacer(rowStart)));
                continue;
            }
            int col = b.left() + 1 + leadingBlanks(interior);
            Position pos = new Position(r + offset, col);
            validate(content, pos, diags);
            placed.add(new Placed(r, col, registry.parse(content, pos, fileBounds)));
        }
        for (Box child : box.children()) {
            placed.add(new Placed(child.bounds().top(), child.bounds().left(), parseBox(grid, child, offset, diags)));
        }
        placed.sort(Comparator.comparingInt(Placed::row).thenComparingInt(Placed::col));

        List<Element> elements = new ArrayList<>();
        for (Placed p : placed) elements.add(p.element());
        elements = trimSpacers(elements);
        return new Element.BoxElement(box.name(), fileBounds, groupRows(elements, fileBounds));
    }

    private static boolean ownedByChild(Box box, int row) {
        for (Box child : box.children()) {
            if (row >= child.bounds().top() && row <= child.bounds().bottom()) return true;
        }
        return false;
    }

    /** Syntax problems the recognisers would otherwise silently turn into text. */
    private static void validate(String content, Position pos, List<Diagnostic> diags) {
        if (content.startsWith("[") && content.indexOf(']') < 0) {
            diags.add(DiagnosticFactory.unclosedBracket(pos, pos.col() + content.length()));
        } else if (EMPTY_BRACKETS.matcher(content).matches()) {
            diags.add(DiagnosticFactory.emptyButton(pos));
        } else if (InputParser.TRIGGER.matcher(content).matches()
                && !content.matches("^#[A-Za-z_][A-Za-z0-9_-]*$")) {
            diags.add(DiagnosticFactory.invalidElement(pos, content));
        }
    }

    /** Blank rows above the first and below the last element carry no spacing. */
    private static List<Element> trimSpacers(List<Element> elements) {
        int from = 0;
        int to = elements.size();
        while (from < to && elements.get(from) instanceof Element.Spacer) from++;
        while (to > from && elements.get(to - 1) instanceof Element.Spacer) to--;
        return new ArrayList<>(elements.subList(from, to));
    }

    /**
     * Replaces each run of two or more adjacent boxes sharing top and bottom
     * rows, ordered left to right without overlap, with a single Row.
     */
    static List<Element> groupRows(List<Element> elements, Bounds container) {
        List<Element> out = new ArrayList<>();
        int i = 0;
        while (i < elements.size()) {
            Element e = elements.get(i);
            if (!(e instanceof Element.BoxElement)) {
                out.add(e);
                i++;
                continue;
            }
            Element.BoxElement first = (Element.BoxElement) e;
            Element.BoxElement last = first;
            int j = i + 1;
            while (j < elements.size() && elements.get(j) instanceof Element.BoxElement) {
                Element.BoxElement next = (Element.BoxElement) elements.get(j);
                if (!rowAligned(last.bounds(), next.bounds())) break;
                last = next;
                j++;
            }
            if (j - i >= 2) {
                int span = last.bounds().right() - first.bounds().left() + 1;
                Alignment align = AlignmentCalc.calculate(span, first.bounds().left(), container);
                out.add(new Element.Row(elements.subList(i, j), align, first.bounds().topLeft()));
            } else {
                out.add(first);
            }
            i = j;
        }
        return out;
    }

    private static boolean rowAligned(Bounds a, Bounds b) {
        return a.top() == b.top() && a.bottom() == b.bottom() && b.left() > a.right();
    }

    private static int leadingBlanks(String s) {
        int n = 0;
        while (n < s.length() && Character.isWhitespace(s.charAt(n))) n++;
        return n;
    }

    private record Placed(int row, int col, Element element) {}

    public record SceneResult(Scene scene, List<Diagnostic> diagnostics) {
        public SceneResult {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
