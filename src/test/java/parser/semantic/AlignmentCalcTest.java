package parser.semantic;

import model.Alignment;
import model.Bounds;
import model.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/** Box (0,0)-(2,22): interior columns 1..21, interior width 20. */
public class AlignmentCalcTest {

	private static final Bounds BOX = new Bounds(0, 0, 2, 22);

	private static Alignment at(int col) {
		return AlignmentCalc.calculate("[ Login ]", Position.of(1, col), BOX, AlignmentCalc.Strategy.RESPECT_POSITION);
	}

	@Test
	void huggingLeftEdge_isLeft() {
		assertEquals(Alignment.LEFT, at(1));
	}

	@Test
	void huggingRightEdge_isRight() {
		assertEquals(Alignment.RIGHT, at(13));
	}

	@Test
	void evenSpaceOnBothSides_isCenter() {
		assertEquals(Alignment.CENTER, at(7));
	}

	@Test
	void undecided_fallsBackToLeft() {
		assertEquals(Alignment.LEFT, at(5));
	}

	@Test
	void alwaysLeftIgnoresPosition() {
		assertEquals(Alignment.LEFT,
				AlignmentCalc.calculate("[ Login ]", Position.of(1, 13), BOX, AlignmentCalc.Strategy.ALWAYS_LEFT));
	}

	@Test
	void noInterior_isLeft() {
		assertEquals(Alignment.LEFT, AlignmentCalc.calculate(1, 1, new Bounds(0, 0, 2, 2)));
	}

	@Test
	void mirroredPositionsGiveMirroredAlignment() {
		int free = 21 - 9;
		for (int leftSpace = 0; leftSpace <= free; leftSpace++) {
			Alignment a = at(1 + leftSpace);
			Alignment b = at(1 + free - leftSpace);
			if (a == Alignment.RIGHT) assertEquals(Alignment.LEFT, b, "leftSpace=" + leftSpace);
			if (a == Alignment.CENTER) assertEquals(Alignment.CENTER, b, "leftSpace=" + leftSpace);
		}
	}
}
