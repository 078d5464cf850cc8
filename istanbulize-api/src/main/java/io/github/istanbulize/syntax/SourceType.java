package io.github.istanbulize.syntax;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Goal symbol the source text is parsed with. Must match how the engine evaluated the text: top-level {@code import}
 * and {@code export} declarations are only permitted for {@link #MODULE}.
 */
public enum SourceType {
    SCRIPT("script"),
    MODULE("module");

    private final String id;

    SourceType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static SourceType fromId(String id) {
        var normalized = id.trim().toLowerCase(Locale.ROOT);
        for (var type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + id + " (expected 'script' or 'module')");
    }
}
