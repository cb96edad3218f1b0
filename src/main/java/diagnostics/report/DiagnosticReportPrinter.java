package diagnostics.report;

import diagnostics.Diagnostic;
import diagnostics.Severity;
import model.Position;

import java.util.*;
import java.util.stream.Collectors;

/** Turns diagnostics into plain text or markdown, with an optional source snippet and caret. */
public final class DiagnosticReportPrinter {
    private DiagnosticReportPrinter() {}

    private static final List<Severity> SEVERITY_ORDER = List.of(Severity.ERROR, Severity.WARNING);

    // -------- Plain text --------
    public static String toText(List<Diagnostic> diags, String source) {
        if (diags == null) diags = List.of();
        List<String> lines = sourceLines(source);

        Map<Severity, List<Diagnostic>> bySeverity = diags.stream()
                .collect(Collectors.groupingBy(Diagnostic::getSeverity));

        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append("Wireframe Check Report").append(nl);

        int errors = bySeverity.getOrDefault(Severity.ERROR, List.of()).size();
        int warns  = bySeverity.getOrDefault(Severity.WARNING, List.of()).size();

        sb.append(String.format("Summary: %d ERROR, %d WARNING", errors, warns)).append(nl);
        sb.append("Pass: ").append(errors == 0 ? "YES" : "NO").append(nl).append(nl);

        for (Severity severity : SEVERITY_ORDER) {
            List<Diagnostic> group = bySeverity.getOrDefault(severity, List.of());
            if (group.isEmpty()) continue;

            sb.append("[").append(severity).append("]").append(nl);
            for (Diagnostic d : group) {
                sb.append(" - ").append(where(d))
                  .append(" :: ").append(d.getKind())
                  .append(" :: ").append(d.getMessage()).append(nl);
                String snippet = snippet(d, lines);
                if (!snippet.isEmpty()) sb.append(snippet.replace("\n", nl));
            }
            sb.append(nl);
        }
        return sb.toString();
    }

    // -------- Markdown --------
    public static String toMarkdown(List<Diagnostic> diags) {
        if (diags == null) diags = List.of();
        Map<Severity, List<Diagnostic>> bySeverity = diags.stream()
                .collect(Collectors.groupingBy(Diagnostic::getSeverity));

        StringBuilder sb = new StringBuilder();
        sb.append("# Wireframe Check Report\n");

        int errors = bySeverity.getOrDefault(Severity.ERROR, List.of()).size();
        int warns  = bySeverity.getOrDefault(Severity.WARNING, List.of()).size();

        sb.append(String.format("**Summary:** %d ERROR, %d WARNING  \n", errors, warns));
        sb.append("**Pass:** ").append(errors == 0 ? "✅ YES" : "❌ NO").append("\n\n");

        for (Severity severity : SEVERITY_ORDER) {
            List<Diagnostic> group = bySeverity.getOrDefault(severity, List.of());
            if (group.isEmpty()) continue;

            sb.append("## ").append(severity).append("\n\n");
            sb.append("| Where | Category | Kind | Message |\n");
            sb.append("|---|---|---|---|\n");
            for (Diagnostic d : group) {
                sb.append("| ")
                  .append(escape(where(d))).append(" | ")
                  .append(d.getKind().category()).append(" | ")
                  .append(escape(d.getKind().name())).append(" | ")
                  .append(escape(d.getMessage())).append(" |\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Source line of the diagnostic with a gutter marker and a caret under its column:
     * <pre>
     *    3 | |  abc  |
     *      |        ^
     * </pre>
     * Empty when the position or the source is unknown.
     */
    public static String snippet(Diagnostic d, List<String> lines) {
        Position p = d.getPosition();
        if (p == null || lines == null || p.row() < 0 || p.row() >= lines.size()) return "";
        String gutter = String.format("%4d | ", p.row() + 1);
        String blank = " ".repeat(gutter.length() - 2) + "| ";
        return gutter + lines.get(p.row()) + "\n"
             + blank + " ".repeat(Math.max(0, p.col())) + "^\n";
    }

    // --- utils ---
    private static String where(Diagnostic d) {
        Position p = d.getPosition();
        return p == null ? "document" : "line " + (p.row() + 1) + ", col " + (p.col() + 1);
    }

    private static List<String> sourceLines(String source) {
        if (source == null) return List.of();
        return Arrays.asList(source.replace("\r\n", "\n").split("\n", -1));
    }

    private static String escape(String s) {
        if (s == null) return "—";
        return s.replace("|", "\\|");
    }
}
