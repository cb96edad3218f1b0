package diagnostics;

public enum DiagnosticKind {
    // structural
    UNCLOSED_BOX(Category.STRUCTURAL, Severity.ERROR),
    MISMATCHED_WIDTH(Category.STRUCTURAL, Severity.ERROR),
    MISALIGNED_PIPE(Category.STRUCTURAL, Severity.ERROR),
    OVERLAPPING_BOXES(Category.STRUCTURAL, Severity.ERROR),
    // syntax
    INVALID_ELEMENT(Category.SYNTAX, Severity.ERROR),
    UNCLOSED_BRACKET(Category.SYNTAX, Severity.ERROR),
    EMPTY_BUTTON(Category.SYNTAX, Severity.ERROR),
    INVALID_INTERACTION_DSL(Category.SYNTAX, Severity.ERROR),
    UNKNOWN_ELEMENT_ID(Category.SYNTAX, Severity.ERROR),
    DUPLICATE_SCENE_ID(Category.SYNTAX, Severity.ERROR),
    // style
    UNUSUAL_SPACING(Category.STYLE, Severity.WARNING),
    DEEP_NESTING(Category.STYLE, Severity.WARNING);

    public enum Category { STRUCTURAL, SYNTAX, STYLE }

    private final Category category;
    private final Severity severity;

    DiagnosticKind(Category category, Severity severity) {
        this.category = category;
        this.severity = severity;
    }

    public Category category() { return category; }
    public Severity severity() { return severity; }
}
