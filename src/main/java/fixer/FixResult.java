package fixer;

import diagnostics.Diagnostic;

import java.util.List;

/**
 * Either the rewritten text with what was fixed and what is left, or the
 * diagnostics of the last parse when fixing did not settle.
 */
public record FixResult(boolean success, String text, List<FixedIssue> fixed,
                        List<Diagnostic> remaining, List<Diagnostic> errors) {

    public FixResult {
        fixed = List.copyOf(fixed);
        remaining = List.copyOf(remaining);
        errors = List.copyOf(errors);
    }

    public static FixResult success(String text, List<FixedIssue> fixed, List<Diagnostic> remaining) {
        return new FixResult(true, text, fixed, remaining, List.of());
    }

    public static FixResult failure(List<Diagnostic> errors) {
        return new FixResult(false, null, List.of(), List.of(), errors);
    }
}
