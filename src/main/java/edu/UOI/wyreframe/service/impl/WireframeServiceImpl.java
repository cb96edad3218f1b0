package edu.UOI.wyreframe.service.impl;

import diagnostics.Diagnostic;
import diagnostics.report.DiagnosticReportPrinter;
import edu.UOI.wyreframe.service.WireframeService;
import fixer.FixResult;
import fixer.FixedIssue;
import fixer.Fixer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import parser.ParseResult;
import parser.WireframeParser;

import java.util.List;

@Service
public class WireframeServiceImpl implements WireframeService {

    private static final Logger log = LoggerFactory.getLogger(WireframeServiceImpl.class);

    private final WireframeParser parser;
    private final Fixer fixer;

    public WireframeServiceImpl(WireframeParser parser, Fixer fixer) {
        this.parser = parser;
        this.fixer = fixer;
    }

    @Override
    public CheckResult check(CheckRequest request) {
        String text = request.text() == null ? "" : request.text();

        // Fix first when asked; fall back to the original text if the fixer does not settle
        List<FixedIssue> fixedIssues = List.of();
        if (request.autoFix()) {
            FixResult fr = fixer.fix(text);
            if (fr.success()) {
                text = fr.text();
                fixedIssues = fr.fixed();
            } else {
                log.warn("Auto-fix did not settle; checking the original text");
            }
        }

        ParseResult pr = parser.parse(text);
        List<Diagnostic> diags = pr.getDiagnostics();

        int scenes = pr.isSuccess() ? pr.getAst().scenes().size() : 0;
        Summary sum = new Summary(scenes, pr.getErrors().size(), pr.getWarnings().size(), fixedIssues.size());
        String report = DiagnosticReportPrinter.toText(diags, text);

        log.info("Checked wireframe: {} lines, {} errors, {} warnings, {} fixes",
                text.isEmpty() ? 0 : text.split("\n", -1).length, sum.errors(), sum.warnings(), sum.fixed());

        return new CheckResult(pr.isSuccess(), sum, pr.getAst(), diags, fixedIssues, text, report);
    }
}
