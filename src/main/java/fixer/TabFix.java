package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticDetail;
import diagnostics.DiagnosticKind;

import java.util.Optional;

/** Replaces every tab on the flagged line with two spaces. */
public final class TabFix implements FixStrategy {

    static final String TAB_REPLACEMENT = "  ";

    @Override
    public boolean canFix(DiagnosticKind kind) {
        return kind == DiagnosticKind.UNUSUAL_SPACING;
    }

    @Override
    public Optional<Applied> apply(String text, Diagnostic diagnostic) {
        DiagnosticDetail.UnusualSpacing d = (DiagnosticDetail.UnusualSpacing) diagnostic.getDetail();
        String line = TextLines.line(text, d.row());
        if (line == null || line.indexOf('\t') < 0) return Optional.empty();
        return Optional.of(new Applied(TextLines.replaceLine(text, d.row(), line.replace("\t", TAB_REPLACEMENT)),
                "Replaced tabs with spaces"));
    }
}
