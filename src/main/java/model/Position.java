package model;

/** Zero-based grid coordinate. */
public record Position(int row, int col) {

    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    public Position right(int n) { return new Position(row, col + n); }
    public Position left(int n)  { return new Position(row, col - n); }
    public Position down(int n)  { return new Position(row + n, col); }
    public Position up(int n)    { return new Position(row - n, col); }

    public Position right() { return right(1); }
    public Position left()  { return left(1); }
    public Position down()  { return down(1); }
    public Position up()    { return up(1); }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
