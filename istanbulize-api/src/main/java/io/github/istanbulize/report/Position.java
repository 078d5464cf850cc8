package io.github.istanbulize.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A point in the source: 1-based line, 0-based UTF-16 column. */
public record Position(@JsonProperty("line") int line, @JsonProperty("column") int column) {

    public Position {
        if (line < 1 || column < 0) {
            throw new IllegalArgumentException("Invalid position " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
