package edu.UOI.wyreframe.service;

import diagnostics.Diagnostic;
import fixer.FixedIssue;
import model.WireframeAst;

import java.util.List;

public interface WireframeService {

	// Input from the UI or API: the wireframe text and whether to auto-fix it first
    record CheckRequest(
            String text,
            boolean autoFix
    ) {}

	// Quick summary: scenes, errors, warnings, fixes
    record Summary(
            int scenes,
            int errors,
            int warnings,
            int fixed
    ) {}

	// Full check result returned to the web layer
    record CheckResult(
            boolean valid,
            Summary summary,
            WireframeAst ast,
            List<Diagnostic> diagnostics,
            List<FixedIssue> fixedIssues,
            String checkedText,
            String reportText
    ) {}

	// Parse (optionally after fixing) and report
    CheckResult check(CheckRequest request);
}
