package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticDetail;
import diagnostics.DiagnosticKind;

import java.util.Optional;

/** Adds the missing ']' right after the content, reusing a trailing space when there is one. */
public final class UnclosedBracketFix implements FixStrategy {

    @Override
    public boolean canFix(DiagnosticKind kind) {
        return kind == DiagnosticKind.UNCLOSED_BRACKET;
    }

    @Override
    public Optional<Applied> apply(String text, Diagnostic diagnostic) {
        DiagnosticDetail.UnclosedBracket d = (DiagnosticDetail.UnclosedBracket) diagnostic.getDetail();
        String line = TextLines.line(text, d.row());
        int at = d.contentEnd();
        if (line == null || at > line.length()) return Optional.empty();

        String fixed;
        if (at < line.length() && line.charAt(at) == ' ') {
            fixed = line.substring(0, at) + "]" + line.substring(at + 1);
        } else {
            fixed = line.substring(0, at) + "]" + line.substring(at);
        }
        return Optional.of(new Applied(TextLines.replaceLine(text, d.row(), fixed), "Added closing bracket"));
    }
}
