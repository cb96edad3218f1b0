package parser;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import model.DeviceType;
import model.Position;
import model.Scene;
import model.WireframeAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parser.interaction.InteractionMerger;
import parser.interaction.InteractionParser;
import parser.interaction.LineInteractionParser;
import parser.semantic.SceneBlock;
import parser.semantic.SceneSplitter;
import parser.semantic.SemanticParser;
import parser.semantic.elements.ParserRegistry;
import parser.shape.HierarchyBuilder;
import parser.shape.ShapeDetector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: text in, scenes or diagnostics out.
 *
 * <p>Each call owns its grid and diagnostics, so one instance can be shared
 * between threads.
 */
public class WireframeParser {

    private static final Logger log = LoggerFactory.getLogger(WireframeParser.class);

    private final SemanticParser semanticParser;
    private final InteractionParser interactionParser;
    private final InteractionMerger merger = new InteractionMerger();

    public WireframeParser() {
        this(HierarchyBuilder.DEFAULT_MAX_DEPTH);
    }

    public WireframeParser(int maxNestingDepth) {
        this(new SemanticParser(new ParserRegistry(), new ShapeDetector(new HierarchyBuilder(maxNestingDepth))),
                new LineInteractionParser());
    }

    public WireframeParser(SemanticParser semanticParser, InteractionParser interactionParser) {
        this.semanticParser = semanticParser;
        this.interactionParser = interactionParser;
    }

    /** Parses a document that may mix wireframes and interaction blocks. */
    public ParseResult parse(String text) {
        return run(text, true);
    }

    /** Parses wireframes only; interaction blocks are left in the text and ignored. */
    public ParseResult parseWireframe(String text) {
        return run(text, false);
    }

    public InteractionParser.Result parseInteractions(String dsl) {
        return interactionParser.parse(dsl);
    }

    public WireframeAst parseOrThrow(String text) {
        ParseResult r = parse(text);
        if (!r.isSuccess()) throw new WireframeParseException(r.getErrors());
        return r.getAst();
    }

    private ParseResult run(String text, boolean withInteractions) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        List<String> lines = splitLines(text);
        List<Diagnostic> diags = new ArrayList<>(tabWarnings(lines));

        List<SceneBlock> blocks = new SceneSplitter(withInteractions).split(lines);
        List<Scene> scenes = new ArrayList<>();
        Map<String, Integer> declared = new LinkedHashMap<>();

        for (SceneBlock block : blocks) {
            SemanticParser.SceneResult sr = semanticParser.parse(block);
            diags.addAll(sr.diagnostics());
            Scene scene = sr.scene();

            if (withInteractions && !block.interactionLines().isEmpty()) {
                InteractionParser.Result ir = interactionParser.parse(block.interactionLines());
                diags.addAll(ir.diagnostics());
                scene = merger.merge(scene, ir.interactions(), diags);
            }

            Integer first = declared.putIfAbsent(scene.id(), block.declaredAt());
            if (first != null) {
                diags.add(DiagnosticFactory.duplicateSceneId(new Position(block.declaredAt(), 0),
                        scene.id(), new Position(first, 0)));
                continue;
            }
            scenes.add(scene);
        }
        if (blocks.isEmpty()) {
            scenes.add(new Scene(Scene.DEFAULT_ID, "Main", Scene.DEFAULT_TRANSITION, DeviceType.DESKTOP, List.of()));
        }

        ParseResult result = ParseResult.of(new WireframeAst(scenes), diags);
        log.debug("Parsed {} scenes: {} errors, {} warnings",
                scenes.size(), result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    /** CRLF and lone CR become LF; trailing whitespace is kept. */
    public static List<String> splitLines(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.isEmpty()) return List.of();
        return List.of(normalized.split("\n", -1));
    }

    private static List<Diagnostic> tabWarnings(List<String> lines) {
        List<Diagnostic> out = new ArrayList<>();
        for (int r = 0; r < lines.size(); r++) {
            int tab = lines.get(r).indexOf('\t');
            if (tab >= 0) out.add(DiagnosticFactory.unusualSpacing(new Position(r, tab)));
        }
        return out;
    }
}
