package fixer;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticKind;
import model.Element;
import org.junit.jupiter.api.Test;
import parser.WireframeParser;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static testutil.Wireframes.*;

public class FixerTest {

	private final Fixer fixer = new Fixer();

	@Test
	void cleanText_isReturnedUnchanged() {
		String text = text(box(6, "hi"));

		FixResult r = fixer.fix(text);

		assertTrue(r.success());
		assertEquals(text, r.text());
		assertTrue(r.fixed().isEmpty());
		assertTrue(r.remaining().isEmpty());
	}

	@Test
	void misalignedPipeIsMovedBack() {
		String broken = text(lines("+------+", "|      |", "|     |", "|      |", "+------+"));
		String expected = text(lines("+------+", "|      |", "|      |", "|      |", "+------+"));

		FixResult r = fixer.fix(broken);

		assertTrue(r.success());
		assertEquals(expected, r.text());
		assertEquals(1, r.fixed().size());
		FixedIssue f = r.fixed().get(0);
		assertEquals(DiagnosticKind.MISALIGNED_PIPE, f.original().getKind());
		assertEquals(3, f.line());
		assertEquals(7, f.column());
		assertTrue(r.remaining().isEmpty());
	}

	@Test
	void tabsThenTheirKnockOnMisalignment() {
		FixResult r = fixer.fix("+----+\n|\tab |\n+----+");

		assertTrue(r.success());
		assertEquals("+----+\n|  ab|\n+----+", r.text());
		assertEquals(List.of(DiagnosticKind.UNUSUAL_SPACING, DiagnosticKind.MISALIGNED_PIPE),
				r.fixed().stream().map(f -> f.original().getKind()).toList());
		assertTrue(r.remaining().isEmpty());
	}

	@Test
	void missingBracketIsAdded() {
		FixResult r = fixer.fix(text(box(12, "[ Login")));

		assertTrue(r.success());
		assertEquals(text(box(12, "[ Login]")), r.text());
		Element.BoxElement b = (Element.BoxElement) new WireframeParser().parseOrThrow(r.text())
				.scenes().get(0).elements().get(0);
		assertEquals("login", ((Element.Button) b.children().get(0)).id());
	}

	@Test
	void shorterBottomBorderIsExtended() {
		FixResult r = fixer.fix("+------+\n|      |\n+----+");

		assertTrue(r.success());
		assertEquals("+------+\n|      |\n+------+", r.text());
		assertEquals("Extended bottom border by 2 dashes", r.fixed().get(0).description());
	}

	@Test
	void unfixableErrorsRemain() {
		FixResult r = fixer.fix("+--incomplete");

		assertTrue(r.success());
		assertEquals("+--incomplete", r.text());
		assertTrue(r.fixed().isEmpty());
		assertEquals(List.of(DiagnosticKind.UNCLOSED_BOX), r.remaining().stream().map(d -> d.getKind()).toList());
	}

	@Test
	void crlfIsNormalised() {
		FixResult r = fixer.fix("+----+\r\n|    |\r\n+----+");

		assertEquals("+----+\n|    |\n+----+", r.text());
	}

	@Test
	void strategyThatNeverSettles_hitsTheCap() {
		FixStrategy restless = new FixStrategy() {
			@Override
			public boolean canFix(DiagnosticKind kind) {
				return kind == DiagnosticKind.UNUSUAL_SPACING;
			}

			@Override
			public Optional<Applied> apply(String text, Diagnostic diagnostic) {
				return Optional.of(new Applied(text + "\n\t", "another tab"));
			}
		};
		Fixer capped = new Fixer(new WireframeParser(), List.of(restless), 3);

		FixResult r = capped.fix("a\tb");

		assertFalse(r.success());
		assertNull(r.text());
		assertFalse(r.errors().isEmpty());
		assertEquals("a\tb", capped.fixOnly("a\tb"));
	}

	@Test
	void fixOnly_returnsFixedText() {
		assertEquals("+------+\n|      |\n+------+", fixer.fixOnly("+------+\n|      |\n+----+"));
	}
}
