package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;
import parser.semantic.AlignmentCalc;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code * Important text} */
public final class EmphasisParser implements ElementParser {

    private static final Pattern EMPHASIS = Pattern.compile("^\\*\\s+(.+)$");

    @Override
    public int priority() { return 70; }

    @Override
    public boolean canParse(String content) {
        return EMPHASIS.matcher(content).matches();
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        Matcher m = EMPHASIS.matcher(content);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new Element.Text(m.group(1).trim(), true, position,
                AlignmentCalc.calculate(content, position, box, AlignmentCalc.Strategy.RESPECT_POSITION)));
    }
}
