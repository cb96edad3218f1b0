package parser;

import diagnostics.Diagnostic;
import model.WireframeAst;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a parse. Successful exactly when no ERROR diagnostic was found;
 * only then is an AST available. Warnings may accompany either outcome.
 */
public final class ParseResult {

    private final WireframeAst ast;
    private final List<Diagnostic> diagnostics;

    private ParseResult(WireframeAst ast, List<Diagnostic> diagnostics) {
        this.ast = ast;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static ParseResult of(WireframeAst ast, List<Diagnostic> diagnostics) {
        boolean failed = diagnostics.stream().anyMatch(Diagnostic::isError);
        return new ParseResult(failed ? null : ast, diagnostics);
    }

    public boolean isSuccess() {
        return ast != null;
    }

    /** @return the AST, or null when the parse failed */
    public WireframeAst getAst() {
        return ast;
    }

    /** Every diagnostic, in the order the pipeline produced them. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(Diagnostic::isWarning).collect(Collectors.toList());
    }
}
