package com.example.verification.routing;

/**
 * Half-open rectangle of grid indices, {@code [rowStart, rowEnd) x [colStart, colEnd)}.
 *
 * <p>Cells are numbered row-major inside the range: cell {@code c} is
 * {@code (rowStart + c / width, colStart + c % width)}.
 */
public record GridRange(int rowStart, int rowEnd, int colStart, int colEnd) {

    public GridRange {
        if (rowStart < 0 || colStart < 0 || rowEnd < rowStart || colEnd < colStart) {
            throw new IllegalArgumentException(
                    "invalid grid range [" + rowStart + "," + rowEnd + ")x[" + colStart + "," + colEnd + ")");
        }
    }

    public int rows() {
        return rowEnd - rowStart;
    }

    public int width() {
        return colEnd - colStart;
    }

    /**
     * @throws ArithmeticException if the cell count does not fit in an int
     */
    public int cellCount() {
        return Math.multiplyExact(rows(), width());
    }

    public int rowOf(int cell) {
        return rowStart + cell / width();
    }

    public int colOf(int cell) {
        return colStart + cell % width();
    }
}
