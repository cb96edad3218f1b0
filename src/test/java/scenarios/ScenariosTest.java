package scenarios;

import org.junit.jupiter.api.*;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

import diagnostics.report.DiagnosticReportPrinter;
import fixer.FixResult;
import fixer.Fixer;
import parser.ParseResult;
import parser.WireframeParser;

/**
 * Handmade-style runner for the scenarios pack.
 * Scenarios live under: src/test/resources/scenarios/ (one .txt wireframe each).
 *
 * Every scenario is parsed as written, then run through the fixer and parsed again.
 */
public class ScenariosTest {

    private static final Path BASE;

    static {
        try {
            // Resolve /scenarios on the TEST classpath (never depends on working dir)
            var url = Objects.requireNonNull(
                    ScenariosTest.class.getClassLoader().getResource("scenarios"),
                    "Cannot locate 'scenarios' in test resources");
            BASE = Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new RuntimeException("Failed to locate scenarios directory from classpath", e);
        }
    }

    private enum Outcome { PASS, FAIL }

    private enum Stage { AS_WRITTEN, AFTER_FIX }

    /** Expected outcomes per scenario per stage (hand-written on purpose). */
    private static final Map<String, Map<Stage, Outcome>> EXPECTED = new LinkedHashMap<>();
    static {
        put("01_login_form",                    PASS(), PASS());
        put("02_dashboard_rows",                PASS(), PASS());
        put("03_unclosed_bottom",               FAIL(), FAIL());
        put("04_multi_scene_with_interactions", PASS(), PASS());
        put("05_misaligned_pipe",               FAIL(), PASS());
        put("06_tabs_and_short_border",         FAIL(), PASS());
        put("07_deep_nesting",                  PASS(), PASS());
        put("08_syntax_errors",                 FAIL(), FAIL());
        put("09_unclosed_bracket",              FAIL(), PASS());
    }
    private static void put(String name, Outcome asWritten, Outcome afterFix) {
        Map<Stage, Outcome> map = new EnumMap<>(Stage.class);
        map.put(Stage.AS_WRITTEN, asWritten);
        map.put(Stage.AFTER_FIX, afterFix);
        EXPECTED.put(name, map);
    }
    private static Outcome PASS() { return Outcome.PASS; }
    private static Outcome FAIL() { return Outcome.FAIL; }

    @Test
    void runAllScenarios() throws Exception {
        assertTrue(Files.isDirectory(BASE), "Scenarios folder not found: " + BASE);

        WireframeParser parser = new WireframeParser();
        Fixer fixer = new Fixer();
        List<String> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Path file : listScenarioFiles(BASE)) {
            String name = file.getFileName().toString().replaceFirst("\\.txt$", "");
            Map<Stage, Outcome> expected = EXPECTED.get(name);
            if (expected == null) {
                failures.add(name + " has no expected outcome.");
                continue;
            }
            seen.add(name);
            String text = Files.readString(file, StandardCharsets.UTF_8);

            ParseResult asWritten = parser.parse(text);
            report(name, Stage.AS_WRITTEN, asWritten, text);
            check(name, Stage.AS_WRITTEN, expected, asWritten, failures);

            FixResult fixed = fixer.fix(text);
            assertTrue(fixed.success(), name + ": fixer did not settle");
            ParseResult afterFix = parser.parse(fixed.text());
            report(name, Stage.AFTER_FIX, afterFix, fixed.text());
            check(name, Stage.AFTER_FIX, expected, afterFix, failures);
        }

        Set<String> missing = new LinkedHashSet<>(EXPECTED.keySet());
        missing.removeAll(seen);
        missing.forEach(m -> failures.add(m + " is expected but has no file."));

        if (!failures.isEmpty()) {
            fail("Scenario expectations not met:\n" + String.join("\n", failures));
        }
    }

    private static void check(String name, Stage stage, Map<Stage, Outcome> expected,
                              ParseResult result, List<String> failures) {
        Outcome want = expected.get(stage);
        if (want == Outcome.PASS && !result.isSuccess()) {
            failures.add(name + " [" + stage + "] expected PASS but found ERROR(s).");
        }
        if (want == Outcome.FAIL && result.isSuccess()) {
            failures.add(name + " [" + stage + "] expected FAIL (ERROR) but found none.");
        }
    }

    private static void report(String name, Stage stage, ParseResult result, String text) {
        System.out.println("--------------------------------------------------");
        System.out.println("Scenario: " + name + " | Stage: " + stage);
        System.out.println(DiagnosticReportPrinter.toText(result.getDiagnostics(), text));
    }

    private static List<Path> listScenarioFiles(Path base) throws Exception {
        try (var stream = Files.list(base)) {
            return stream
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
