package parser.semantic.elements;

import model.Bounds;
import model.Element;
import model.Position;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code [x] label} or {@code [ ] label} */
public final class CheckboxParser implements ElementParser {

    private static final Pattern CHECKBOX = Pattern.compile("^\\[([xX ])\\]\\s*(.*)$");

    @Override
    public int priority() { return 85; }

    @Override
    public boolean canParse(String content) {
        return CHECKBOX.matcher(content).matches();
    }

    @Override
    public Optional<Element> parse(String content, Position position, Bounds box) {
        Matcher m = CHECKBOX.matcher(content);
        if (!m.matches()) return Optional.empty();
        String label = m.group(2).trim();
        if (label.isEmpty()) return Optional.empty();
        boolean checked = !m.group(1).isBlank();
        return Optional.of(new Element.Checkbox(checked, label, position));
    }
}
