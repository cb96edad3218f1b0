package parser.semantic;

import model.Alignment;
import model.Bounds;
import model.Position;

/**
 * Infers horizontal alignment from how much free space sits on each side of
 * a piece of content inside its box.
 */
public final class AlignmentCalc {
    private AlignmentCalc() {}

    static final double EDGE_RATIO = 0.2;
    static final double OPEN_RATIO = 0.3;
    static final double CENTER_TOLERANCE = 0.15;

    public enum Strategy {
        /** Decide from the left/right space ratios. */
        RESPECT_POSITION,
        /** Always LEFT, whatever the position. */
        ALWAYS_LEFT
    }

    public static Alignment calculate(String content, Position position, Bounds box, Strategy strategy) {
        if (strategy == Strategy.ALWAYS_LEFT) return Alignment.LEFT;
        return calculate(content.length(), position.col(), box);
    }

    /** @param length number of columns the content spans, starting at {@code col} */
    public static Alignment calculate(int length, int col, Bounds box) {
        int interiorWidth = box.right() - box.left() - 2;
        if (interiorWidth <= 0) return Alignment.LEFT;

        int interiorLeft = box.left() + 1;
        int interiorRight = box.right() - 1;
        int leftSpace = col - interiorLeft;
        int contentEnd = col + length;
        int rightSpace = interiorRight - contentEnd + 1;

        double leftRatio = (double) leftSpace / interiorWidth;
        double rightRatio = (double) rightSpace / interiorWidth;

        if (leftRatio < EDGE_RATIO && rightRatio > OPEN_RATIO) return Alignment.LEFT;
        if (rightRatio < EDGE_RATIO && leftRatio > OPEN_RATIO) return Alignment.RIGHT;
        if (Math.abs(leftRatio - rightRatio) < CENTER_TOLERANCE) return Alignment.CENTER;
        return Alignment.LEFT;
    }
}
