package parser.interaction;

/** A line of text together with its zero-based line number in the original document. */
public record SourceLine(int row, String text) {}
