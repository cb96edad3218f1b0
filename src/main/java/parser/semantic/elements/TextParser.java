package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;
import parser.semantic.AlignmentCalc;

import java.util.Optional;

/** Fallback: any content is plain, left-aligned text. */
public final class TextParser implements ElementParser {

    @Override
    public int priority() { return 1; }

    @Override
    public boolean canParse(String content) {
        return true;
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        return Optional.of(new Element.Text(content, false, position,
                AlignmentCalc.calculate(content, position, box, AlignmentCalc.Strategy.ALWAYS_LEFT)));
    }
}
