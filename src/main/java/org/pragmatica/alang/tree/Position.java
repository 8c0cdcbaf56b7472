package org.pragmatica.alang.tree;

/**
 * A range in source text. Lines and columns are 1-based, the end column is exclusive.
 */
public record Position(int startLine, int startCol, int endLine, int endCol) {

    /**
     * Synthetic span used for nodes that cover no source text (an empty program).
     */
    public static final Position ZERO = new Position(0, 0, 0, 0);

    public static Position of(int startLine, int startCol, int endLine, int endCol) {
        return new Position(startLine, startCol, endLine, endCol);
    }

    /**
     * Span starting where {@code first} starts and ending where {@code last} ends.
     */
    public static Position between(Position first, Position last) {
        return first.merge(last);
    }

    public Position merge(Position other) {
        var startsFirst = compare(startLine, startCol, other.startLine, other.startCol) <= 0;
        var endsLast = compare(endLine, endCol, other.endLine, other.endCol) >= 0;
        return new Position(startsFirst ? startLine : other.startLine,
                            startsFirst ? startCol : other.startCol,
                            endsLast ? endLine : other.endLine,
                            endsLast ? endCol : other.endCol);
    }

    public boolean contains(Position other) {
        return compare(startLine, startCol, other.startLine, other.startCol) <= 0
               && compare(endLine, endCol, other.endLine, other.endCol) >= 0;
    }

    /**
     * Diagnostic rendering: {@code [startLine,startCol]-[endLine,endCol]}.
     */
    public String span() {
        return "[" + startLine + "," + startCol + "]-[" + endLine + "," + endCol + "]";
    }

    private static int compare(int lineA, int colA, int lineB, int colB) {
        return lineA != lineB ? Integer.compare(lineA, lineB) : Integer.compare(colA, colB);
    }

    @Override
    public String toString() {
        return span();
    }
}
