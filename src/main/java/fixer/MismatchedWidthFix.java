package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticDetail;
import diagnostics.DiagnosticKind;

import java.util.Optional;

/**
 * Extends the shorter horizontal border with dashes just before its right
 * corner. Boxes whose left corners disagree are left alone.
 */
public final class MismatchedWidthFix implements FixStrategy {

    @Override
    public boolean canFix(DiagnosticKind kind) {
        return kind == DiagnosticKind.MISMATCHED_WIDTH;
    }

    @Override
    public Optional<Applied> apply(String text, Diagnostic diagnostic) {
        DiagnosticDetail.MismatchedWidth d = (DiagnosticDetail.MismatchedWidth) diagnostic.getDetail();
        int leftCol = d.topLeft().col();
        if (d.bottomLeftCol() != leftCol) return Optional.empty();

        int diff = Math.abs(d.topWidth() - d.bottomWidth());
        boolean topShorter = d.topWidth() < d.bottomWidth();
        int row = topShorter ? d.topLeft().row() : d.bottomRow();
        int cornerCol = leftCol + Math.min(d.topWidth(), d.bottomWidth());

        String line = TextLines.line(text, row);
        if (line == null || cornerCol >= line.length() || line.charAt(cornerCol) != '+') return Optional.empty();

        String fixed = line.substring(0, cornerCol) + TextLines.repeat('-', diff) + line.substring(cornerCol);
        return Optional.of(new Applied(TextLines.replaceLine(text, row, fixed),
                "Extended " + (topShorter ? "top" : "bottom") + " border by " + diff
                        + (diff == 1 ? " dash" : " dashes")));
    }
}
