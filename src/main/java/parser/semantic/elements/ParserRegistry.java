package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** The fixed set of recognisers, tried from highest to lowest priority. */
public final class ParserRegistry {

    private static final List<ElementParser> DEFAULT_PARSERS = List.of(
            new ButtonParser(),
            new InputParser(),
            new CheckboxParser(),
            new LinkParser(),
            new EmphasisParser(),
            new TextParser());

    private final List<ElementParser> parsers;
    private final TextParser fallback = new TextParser();

    public ParserRegistry() {
        this(DEFAULT_PARSERS);
    }

    public ParserRegistry(List<ElementParser> parsers) {
        List<ElementParser> sorted = new ArrayList<>(parsers);
        sorted.sort(Comparator.comparingInt(ElementParser::priority).reversed());
        this.parsers = List.copyOf(sorted);
    }

    public List<ElementParser> parsers() {
        return parsers;
    }

    public Element parse(String content, Position position, Bounds box) {
        for (ElementParser p : parsers) {
            if (!p.canParse(content)) continue;
            Optional<Element> e = p.parse(content, position, box);
            if (e.isPresent()) return e.get();
        }
        return fallback.parse(content, position, box).orElseThrow();
    }
}
