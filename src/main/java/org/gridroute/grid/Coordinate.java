package org.gridroute.grid;

/**
 * Integer cell address on a square grid.
 *
 * <p>Equality is by value. Bounds are not enforced here; {@link Grid#inBounds(Coordinate)}
 * owns that contract.</p>
 *
 * @param x column index.
 * @param y row index ({@code 0} is the bottom row when rendered).
 */
public record Coordinate(int x, int y) {

    /**
     * Shorthand factory used by fixtures and the CLI.
     */
    public static Coordinate of(int x, int y) {
        return new Coordinate(x, y);
    }

    /**
     * Parses {@code "x,y"} (surrounding whitespace and parentheses are tolerated).
     *
     * @throws IllegalArgumentException when the text is not two comma-separated integers.
     */
    public static Coordinate parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("coordinate text must be provided");
        }
        String trimmed = text.strip();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        String[] parts = trimmed.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("expected x,y but got: " + text);
        }
        try {
            return new Coordinate(Integer.parseInt(parts[0].strip()), Integer.parseInt(parts[1].strip()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("expected integer x,y but got: " + text, ex);
        }
    }

    /**
     * Chebyshev (king-move) distance to another coordinate.
     */
    public int chebyshevDistance(Coordinate other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    /**
     * Whether {@code other} is one of the eight cells surrounding this one.
     */
    public boolean isAdjacentTo(Coordinate other) {
        return !equals(other) && chebyshevDistance(other) == 1;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
