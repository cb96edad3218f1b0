package fixer;

import diagnostics.Diagnostic;
import model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parser.WireframeParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repairs fixable diagnostics one at a time: parse, apply the first fix that
 * succeeds, parse again. Positions move after every edit, so fixes are never
 * batched. Stops when nothing fixable is left or after {@code maxIterations}.
 */
public class Fixer {

    private static final Logger log = LoggerFactory.getLogger(Fixer.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final List<FixStrategy> DEFAULT_STRATEGIES = List.of(
            new MisalignedPipeFix(),
            new TabFix(),
            new UnclosedBracketFix(),
            new MismatchedWidthFix());

    private final WireframeParser parser;
    private final List<FixStrategy> strategies;
    private final int maxIterations;

    public Fixer() {
        this(new WireframeParser(), DEFAULT_MAX_ITERATIONS);
    }

    public Fixer(WireframeParser parser, int maxIterations) {
        this(parser, DEFAULT_STRATEGIES, maxIterations);
    }

    public Fixer(WireframeParser parser, List<FixStrategy> strategies, int maxIterations) {
        this.parser = parser;
        this.strategies = List.copyOf(strategies);
        this.maxIterations = maxIterations;
    }

    public FixResult fix(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        String current = text.replace("\r\n", "\n").replace('\r', '\n');
        List<FixedIssue> fixed = new ArrayList<>();

        for (int i = 0; i < maxIterations; i++) {
            List<Diagnostic> diags = parser.parse(current).getDiagnostics();
            Step step = firstApplicable(current, diags);
            if (step == null) {
                log.debug("Fixer settled after {} fixes, {} diagnostics remain", fixed.size(), diags.size());
                return FixResult.success(current, fixed, diags);
            }
            current = step.applied().text();
            Position p = step.diagnostic().getPosition();
            fixed.add(new FixedIssue(step.diagnostic(), step.applied().description(),
                    p == null ? 0 : p.row() + 1, p == null ? 0 : p.col() + 1));
            log.debug("Applied fix: {} ({})", step.applied().description(), step.diagnostic().getKind());
        }

        log.warn("Fixer stopped after {} iterations without settling", maxIterations);
        return FixResult.failure(parser.parse(current).getDiagnostics());
    }

    /** Fixed text, or the original when fixing fails. */
    public String fixOnly(String text) {
        FixResult r = fix(text);
        return r.success() ? r.text() : text;
    }

    private Step firstApplicable(String text, List<Diagnostic> diags) {
        for (Diagnostic d : diags) {
            for (FixStrategy s : strategies) {
                if (!s.canFix(d.getKind())) continue;
                Optional<FixStrategy.Applied> a = s.apply(text, d);
                if (a.isPresent() && !a.get().text().equals(text)) return new Step(d, a.get());
            }
        }
        return null;
    }

    private record Step(Diagnostic diagnostic, FixStrategy.Applied applied) {}
}
