package io.github.istanbulize.syntax;

/** The source text could not be parsed. Line is 1-based, column 0-based. */
public class SourceParseException extends RuntimeException {
    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message + " (" + line + ":" + column + ")");
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
