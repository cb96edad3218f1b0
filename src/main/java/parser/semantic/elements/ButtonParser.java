package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;
import parser.semantic.AlignmentCalc;
import parser.semantic.Slugs;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code [ Label ]} */
public final class ButtonParser implements ElementParser {

    private static final Pattern BUTTON = Pattern.compile("^\\[([^\\[\\]]*)\\]$");

    @Override
    public int priority() { return 100; }

    @Override
    public boolean canParse(String content) {
        return BUTTON.matcher(content).matches();
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        Matcher m = BUTTON.matcher(content);
        if (!m.matches()) return Optional.empty();
        String text = m.group(1).trim();
        if (text.isEmpty()) return Optional.empty();
        return Optional.of(new Element.Button(Slugs.slugify(text), text, position,
                AlignmentCalc.calculate(content, position, box, AlignmentCalc.Strategy.RESPECT_POSITION)));
    }
}
