package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticKind;

import java.util.Optional;

/** A targeted text rewrite for one kind of diagnostic. */
public interface FixStrategy {

    boolean canFix(DiagnosticKind kind);

    /**
     * @return the rewritten text and a description of the change, or empty
     *         when this particular occurrence cannot be fixed safely
     */
    Optional<Applied> apply(String text, Diagnostic diagnostic);

    record Applied(String text, String description) {}
}
