package parser.shape;

import diagnostics.Diagnostic;
import diagnostics.DiagnosticDetail;
import diagnostics.DiagnosticKind;
import diagnostics.Direction;
import model.Bounds;
import model.Position;
import org.junit.jupiter.api.Test;
import parser.grid.Grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static testutil.Wireframes.*;

public class BoxTracerTest {

	private static TraceResult trace(List<String> lines, Position start) {
		return new BoxTracer(Grid.fromLines(lines)).traceBox(start);
	}

	@Test
	void tracesSimpleBox() {
		TraceResult r = trace(lines("+----+", "|    |", "+----+"), Position.of(0, 0));

		assertTrue(r.isOk(), () -> "unexpected: " + r.diagnostics());
		assertEquals(new Bounds(0, 0, 2, 5), r.box().bounds());
		assertNull(r.box().name());
	}

	@Test
	void readsNameFromTopBorder() {
		TraceResult r = trace(namedBox("Login", 9, ""), Position.of(0, 0));

		assertTrue(r.isOk());
		assertEquals("Login", r.box().name());
		assertEquals(new Bounds(0, 0, 2, 10), r.box().bounds());
	}

	@Test
	void closure_anyWellFormedBoxTracesToItsBounds() {
		for (int w = 1; w <= 8; w++) {
			for (int h = 1; h <= 5; h++) {
				String[] content = new String[h - 1];
				Arrays.fill(content, "");
				List<String> drawn = indent(3, box(w, content));
				List<String> doc = new ArrayList<>();
				doc.add("");
				doc.add("");
				doc.addAll(drawn);

				TraceResult r = trace(doc, Position.of(2, 3));

				assertTrue(r.isOk(), "w=" + w + " h=" + h + ": " + r.diagnostics());
				assertEquals(new Bounds(2, 3, 2 + h, 3 + w + 1), r.box().bounds(), "w=" + w + " h=" + h);
			}
		}
	}

	@Test
	void unclosedTop() {
		TraceResult r = trace(lines("+--incomplete"), Position.of(0, 0));

		assertFalse(r.isOk());
		assertEquals(1, r.diagnostics().size());
		Diagnostic d = r.diagnostics().get(0);
		assertEquals(DiagnosticKind.UNCLOSED_BOX, d.getKind());
		assertEquals(Direction.TOP, ((DiagnosticDetail.UnclosedBox) d.getDetail()).direction());
	}

	@Test
	void unclosedBottom() {
		TraceResult r = trace(lines("+----+", "|    |", "+----"), Position.of(0, 0));

		assertFalse(r.isOk());
		assertEquals(1, r.diagnostics().size());
		Diagnostic d = r.diagnostics().get(0);
		assertEquals(DiagnosticKind.UNCLOSED_BOX, d.getKind());
		assertEquals(Direction.BOTTOM, ((DiagnosticDetail.UnclosedBox) d.getDetail()).direction());
		assertTrue(d.isError());
	}

	@Test
	void unclosedRight_whenBottomClosesWhereTheTopDid() {
		TraceResult r = trace(lines("+----+", "|    |", "|", "+----+"), Position.of(0, 0));

		assertFalse(r.isOk());
		DiagnosticDetail.UnclosedBox u = (DiagnosticDetail.UnclosedBox) r.diagnostics().get(0).getDetail();
		assertEquals(Direction.RIGHT, u.direction());
	}

	@Test
	void shorterBottom_isMismatchedWidth() {
		TraceResult r = trace(lines("+------+", "|      |", "+----+"), Position.of(0, 0));

		assertFalse(r.isOk());
		Diagnostic d = r.diagnostics().get(0);
		assertEquals(DiagnosticKind.MISMATCHED_WIDTH, d.getKind());
		DiagnosticDetail.MismatchedWidth mw = (DiagnosticDetail.MismatchedWidth) d.getDetail();
		assertEquals(7, mw.topWidth());
		assertEquals(5, mw.bottomWidth());
		assertEquals(2, mw.bottomRow());
		assertEquals(0, mw.bottomLeftCol());
	}

	@Test
	void pipeOneColumnOff_isMisalignedAndWalkContinues() {
		TraceResult r = trace(lines(
				"+------+",
				"|      |",
				"|     |",
				"|      |",
				"+------+"), Position.of(0, 0));

		assertFalse(r.isOk());
		assertEquals(1, r.diagnostics().size(), () -> r.diagnostics().toString());
		Diagnostic d = r.diagnostics().get(0);
		assertEquals(DiagnosticKind.MISALIGNED_PIPE, d.getKind());
		DiagnosticDetail.MisalignedPipe mp = (DiagnosticDetail.MisalignedPipe) d.getDetail();
		assertEquals(2, mp.row());
		assertEquals(7, mp.expectedCol());
		assertEquals(6, mp.actualCol());
		assertEquals(Position.of(2, 6), d.getPosition());
	}

	@Test
	void onlyTopLeftCornersAreCandidates() {
		Grid g = Grid.fromLines(lines("+----+", "|    |", "+----+"));
		BoxTracer t = new BoxTracer(g);

		assertTrue(t.isTopLeftCandidate(Position.of(0, 0)));
		assertFalse(t.isTopLeftCandidate(Position.of(0, 5)));
		assertFalse(t.isTopLeftCandidate(Position.of(2, 0)));
		assertFalse(t.isTopLeftCandidate(Position.of(2, 5)));
	}

	@Test
	void leftPipeOffOnLastInteriorRow_isMisalignedAndKeepsCorners() {
		TraceResult r = trace(lines(
				"+----+",
				"|    |",
				" |   |",
				"+----+"), Position.of(0, 0));

		assertFalse(r.isOk());
		assertEquals(1, r.diagnostics().size(), () -> r.diagnostics().toString());
		DiagnosticDetail.MisalignedPipe mp = (DiagnosticDetail.MisalignedPipe) r.diagnostics().get(0).getDetail();
		assertEquals(2, mp.row());
		assertEquals(0, mp.expectedCol());
		assertEquals(1, mp.actualCol());
		assertTrue(r.corners().contains(Position.of(3, 0)));
		assertTrue(r.corners().contains(Position.of(3, 5)));
	}

	@Test
	void unclosedLeft() {
		TraceResult r = trace(lines("+----+", "|    |", "     |", "+----+"), Position.of(0, 0));

		assertFalse(r.isOk());
		assertEquals(1, r.diagnostics().size(), () -> r.diagnostics().toString());
		Diagnostic d = r.diagnostics().get(0);
		assertEquals(DiagnosticKind.UNCLOSED_BOX, d.getKind());
		assertEquals(Direction.LEFT, ((DiagnosticDetail.UnclosedBox) d.getDetail()).direction());
	}

	@Test
	void nameRightAfterCorner() {
		List<String> box = lines("+Login---+", "|  hi    |", "+--------+");
		assertTrue(new BoxTracer(Grid.fromLines(box)).isTopLeftCandidate(Position.of(0, 0)));

		TraceResult r = trace(box, Position.of(0, 0));

		assertTrue(r.isOk(), () -> "unexpected: " + r.diagnostics());
		assertEquals("Login", r.box().name());
		assertEquals(new Bounds(0, 0, 2, 9), r.box().bounds());
	}

	@Test
	void plusInsideText_isNotACandidate() {
		BoxTracer t = new BoxTracer(Grid.fromLines(lines("+--------+", "| 1+1=2  |", "+--------+")));

		assertFalse(t.isTopLeftCandidate(Position.of(1, 3)));
	}
}
