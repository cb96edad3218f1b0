package edu.UOI.wyreframe.web;

import diagnostics.Diagnostic;
import fixer.FixResult;
import fixer.Fixer;
import model.WireframeAst;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import parser.ParseResult;
import parser.WireframeParser;

import java.util.List;

/** JSON API. Parse failures are ordinary responses with success=false, not HTTP errors. */
@RestController
@RequestMapping("/api")
public class WireframeApiController {

    private final WireframeParser parser;
    private final Fixer fixer;

    public WireframeApiController(WireframeParser parser, Fixer fixer) {
        this.parser = parser;
        this.fixer = fixer;
    }

    public record ParseResponse(boolean success, WireframeAst ast, List<Diagnostic> errors, List<Diagnostic> warnings) {}

    @PostMapping(value = "/parse", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ParseResponse> parse(@RequestBody(required = false) String text) {
        ParseResult r = parser.parse(text == null ? "" : text);
        return ResponseEntity.ok(new ParseResponse(r.isSuccess(), r.getAst(), r.getErrors(), r.getWarnings()));
    }

    @PostMapping(value = "/fix", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FixResult> fix(@RequestBody(required = false) String text) {
        return ResponseEntity.ok(fixer.fix(text == null ? "" : text));
    }
}
