package model;

/**
 * Inclusive rectangle in grid coordinates. Zero height or width is legal and
 * describes a single line or column.
 */
public record Bounds(int top, int left, int bottom, int right) {

    public Bounds {
        if (top > bottom || left > right) {
            throw new IllegalArgumentException(
                    "Invalid bounds: top=" + top + " left=" + left + " bottom=" + bottom + " right=" + right);
        }
    }

    public static Bounds of(Position topLeft, Position bottomRight) {
        return new Bounds(topLeft.row(), topLeft.col(), bottomRight.row(), bottomRight.col());
    }

    public int width()  { return right - left; }
    public int height() { return bottom - top; }
    public int area()   { return width() * height(); }

    public Position topLeft()     { return new Position(top, left); }
    public Position bottomRight() { return new Position(bottom, right); }

    /** Strict containment: every edge of {@code other} lies inside this rectangle, no touching. */
    public boolean contains(Bounds other) {
        return top < other.top && left < other.left && bottom > other.bottom && right > other.right;
    }

    public boolean containsPosition(Position p) {
        return p.row() >= top && p.row() <= bottom && p.col() >= left && p.col() <= right;
    }

    /** True when the two rectangles share at least one cell. */
    public boolean overlaps(Bounds other) {
        return top <= other.bottom && other.top <= bottom && left <= other.right && other.left <= right;
    }

    public Bounds shift(int rows) {
        return rows == 0 ? this : new Bounds(top + rows, left, bottom + rows, right);
    }

    @Override
    public String toString() {
        return "[" + top + "," + left + " .. " + bottom + "," + right + "]";
    }
}
