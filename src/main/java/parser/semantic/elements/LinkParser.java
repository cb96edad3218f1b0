package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;
import parser.semantic.AlignmentCalc;
import parser.semantic.Slugs;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code "Link text"} */
public final class LinkParser implements ElementParser {

    private static final Pattern LINK = Pattern.compile("^\"([^\"]+)\"$");

    @Override
    public int priority() { return 80; }

    @Override
    public boolean canParse(String content) {
        return LINK.matcher(content).matches();
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        Matcher m = LINK.matcher(content);
        if (!m.matches()) return Optional.empty();
        String text = m.group(1).trim();
        if (text.isEmpty()) return Optional.empty();
        return Optional.of(new Element.Link(Slugs.slugify(text), text, position,
                AlignmentCalc.calculate(content, position, box, AlignmentCalc.Strategy.RESPECT_POSITION)));
    }
}
