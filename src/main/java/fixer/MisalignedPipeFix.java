package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticDetail;
import diagnostics.DiagnosticKind;

import java.util.Optional;

/**
 * Moves a stray border pipe back to its column by inserting or removing the
 * spaces right before it. Declines when anything but spaces would have to go.
 */
public final class MisalignedPipeFix implements FixStrategy {

    @Override
    public boolean canFix(DiagnosticKind kind) {
        return kind == DiagnosticKind.MISALIGNED_PIPE;
    }

    @Override
    public Optional<Applied> apply(String text, Diagnostic diagnostic) {
        DiagnosticDetail.MisalignedPipe d = (DiagnosticDetail.MisalignedPipe) diagnostic.getDetail();
        String line = TextLines.line(text, d.row());
        int actual = d.actualCol();
        if (line == null || actual >= line.length() || line.charAt(actual) != '|') return Optional.empty();

        int shift = d.expectedCol() - actual;
        String fixed;
        if (shift > 0) {
            fixed = line.substring(0, actual) + TextLines.repeat(' ', shift) + line.substring(actual);
        } else {
            int from = actual + shift;
            if (from < 0 || !line.substring(from, actual).isBlank() || line.substring(from, actual).contains("\t")) {
                return Optional.empty();
            }
            fixed = line.substring(0, from) + line.substring(actual);
        }
        return Optional.of(new Applied(TextLines.replaceLine(text, d.row(), fixed),
                "Moved pipe from column " + (actual + 1) + " to column " + (d.expectedCol() + 1)));
    }
}
