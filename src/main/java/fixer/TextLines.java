package fixer;

import java.util.ArrayList;
import java.util.List;

/** Line-level editing helpers for the fix strategies. Text is expected with LF endings. */
final class TextLines {
    private TextLines() {}

    static List<String> split(String text) {
        List<String> out = new ArrayList<>();
        for (String s : text.split("\n", -1)) out.add(s);
        return out;
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    static String replaceLine(String text, int row, String newLine) {
        List<String> lines = split(text);
        lines.set(row, newLine);
        return join(lines);
    }

    static String line(String text, int row) {
        List<String> lines = split(text);
        return row >= 0 && row < lines.size() ? lines.get(row) : null;
    }

    static String repeat(char c, int n) {
        return String.valueOf(c).repeat(Math.max(0, n));
    }
}
