package fixer;

import diagnostics.Diagnostic;

/** One applied fix. {@code line} and {@code column} are 1-based. */
public record FixedIssue(Diagnostic original, String description, int line, int column) {}
