package org.vain.astnode;

/**
 * A location in a source file.
 * <p>
 * {@code line} is 1-origin and {@code col} is 0-origin; the column is converted
 * to 1-origin only when a diagnostic is printed.
 */
public final class Position {
    public final int offset;
    public final int line;
    public final int col;

    public Position(int offset, int line, int col) {
        this.offset = offset;
        this.line = line;
        this.col = col;
    }

    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        if (col != other.col) {
            return Integer.compare(col, other.col);
        }
        return Integer.compare(offset, other.offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position p = (Position) o;
        return offset == p.offset && line == p.line && col == p.col;
    }

    @Override
    public int hashCode() {
        return (offset * 31 + line) * 31 + col;
    }

    /**
     * Returns {@code line:col} with a 1-origin column, as printed in diagnostics.
     */
    @Override
    public String toString() {
        return line + ":" + (col + 1);
    }
}
