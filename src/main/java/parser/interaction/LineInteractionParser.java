package parser.interaction;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticFactory;
import model.Action;
import model.Position;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Line-oriented interaction parser.
 *
 * <pre>
 * [ Login ]:
 *   variant: primary
 *   &#64;click -> goto(dashboard, slide-left)
 * </pre>
 */
public final class LineInteractionParser implements InteractionParser {

    @Override
    public Result parse(List<SourceLine> lines) {
        List<ElementInteraction> out = new ArrayList<>();
        List<Diagnostic> diags = new ArrayList<>();

        String currentId = null;
        Position currentPos = null;
        Map<String, Object> props = new LinkedHashMap<>();
        List<Action> actions = new ArrayList<>();

        for (SourceLine line : lines) {
            String text = line.text();
            if (text.isBlank()) continue;

            if (InteractionSyntax.isSelector(text)) {
                if (currentId != null) out.add(new ElementInteraction(currentId, props, actions, currentPos));
                currentId = InteractionSyntax.selectorId(text);
                currentPos = new Position(line.row(), 0);
                props = new LinkedHashMap<>();
                actions = new ArrayList<>();
                continue;
            }

            int indent = text.length() - text.stripLeading().length();
            Position at = new Position(line.row(), indent);
            String t = text.strip();
            if (currentId == null || indent == 0) {
                diags.add(DiagnosticFactory.invalidInteraction(at, "expected a selector such as #id: but found '" + t + "'"));
                continue;
            }

            if (t.startsWith("@")) {
                Action a = parseAction(t, at, diags);
                if (a != null) actions.add(a);
                continue;
            }

            Matcher pm = InteractionSyntax.PROPERTY.matcher(t);
            if (pm.matches()) {
                String value = pm.group(2).strip();
                if (value.isEmpty()) {
                    diags.add(DiagnosticFactory.invalidInteraction(at, "property '" + pm.group(1) + "' has no value"));
                } else {
                    props.put(pm.group(1), parseValue(value));
                }
                continue;
            }
            diags.add(DiagnosticFactory.invalidInteraction(at, "cannot read '" + t + "'"));
        }
        if (currentId != null) out.add(new ElementInteraction(currentId, props, actions, currentPos));
        return new Result(out, diags);
    }

    private static Action parseAction(String t, Position at, List<Diagnostic> diags) {
        Matcher m = InteractionSyntax.ACTION.matcher(t);
        if (!m.matches()) {
            diags.add(DiagnosticFactory.invalidInteraction(at, "malformed action '" + t + "'"));
            return null;
        }
        String name = m.group(2).toLowerCase(Locale.ROOT);
        String argText = m.group(3).strip();
        List<String> args = new ArrayList<>();
        if (!argText.isEmpty()) {
            for (String a : argText.split(",")) args.add(a.strip());
        }
        switch (name) {
            case "goto":
                if (args.isEmpty() || args.size() > 2 || args.get(0).isEmpty()) {
                    diags.add(DiagnosticFactory.invalidInteraction(at, "goto needs a scene id and an optional transition"));
                    return null;
                }
                return new Action.Goto(args.get(0), args.size() == 2 ? args.get(1) : null);
            case "back":
                return new Action.Back();
            case "forward":
                return new Action.Forward();
            default:
                diags.add(DiagnosticFactory.invalidInteraction(at, "unknown action '" + name + "'"));
                return null;
        }
    }

    static Object parseValue(String v) {
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) return v.substring(1, v.length() - 1);
        if ("true".equals(v)) return Boolean.TRUE;
        if ("false".equals(v)) return Boolean.FALSE;
        if (v.matches("-?\\d{1,9}")) return Integer.valueOf(v);
        return v;
    }
}
