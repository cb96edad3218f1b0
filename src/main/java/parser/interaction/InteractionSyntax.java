package parser.interaction;

import parser.semantic.Slugs;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Line shapes of the interaction language, shared by the extractor and the parser. */
public final class InteractionSyntax {
    private InteractionSyntax() {}

    // #email:   [ Login ]:   "Forgot password":
    static final Pattern SELECTOR =
            Pattern.compile("^(#[A-Za-z_][A-Za-z0-9_-]*|\\[[^\\[\\]]+\\]|\"[^\"]+\")\\s*:\\s*$");
    // variant: primary
    static final Pattern PROPERTY = Pattern.compile("^([A-Za-z][A-Za-z0-9_-]*)\\s*:\\s*(.*)$");
    // @click -> goto(dashboard, slide-left)
    static final Pattern ACTION = Pattern.compile("^@([A-Za-z]+)\\s*->\\s*([A-Za-z]+)\\s*\\((.*)\\)\\s*$");

    /** Selector lines start in column 0. */
    public static boolean isSelector(String line) {
        return SELECTOR.matcher(line).matches();
    }

    /** Indented property or action line belonging to the selector above it. */
    public static boolean isBodyLine(String line) {
        if (line.isEmpty() || !Character.isWhitespace(line.charAt(0))) return false;
        String t = line.strip();
        return t.startsWith("@") || PROPERTY.matcher(t).matches();
    }

    /** Element id a selector refers to. */
    static String selectorId(String line) {
        Matcher m = SELECTOR.matcher(line);
        if (!m.matches()) return null;
        String s = m.group(1);
        if (s.startsWith("#")) return s.substring(1);
        return Slugs.slugify(s.substring(1, s.length() - 1));
    }
}
