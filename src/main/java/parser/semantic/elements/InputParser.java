package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code #identifier} */
public final class InputParser implements ElementParser {

    /** Anything that looks like an attempt at an input field. */
    public static final Pattern TRIGGER = Pattern.compile("^#[^\\s#]\\S*$");
    private static final Pattern INPUT = Pattern.compile("^#([A-Za-z_][A-Za-z0-9_-]*)$");

    @Override
    public int priority() { return 90; }

    @Override
    public boolean canParse(String content) {
        return TRIGGER.matcher(content).matches();
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        Matcher m = INPUT.matcher(content);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new Element.Input(m.group(1), position));
    }
}
