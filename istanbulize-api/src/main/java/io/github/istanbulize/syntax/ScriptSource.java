package io.github.istanbulize.syntax;

/**
 * Source text of one script together with the goal it must be parsed with. The text has to be wrapped exactly like
 * the coverage offsets are (see the module wrapper utility for unwrapping both).
 */
public record ScriptSource(String sourceText, SourceType sourceType) {

    public static ScriptSource script(String sourceText) {
        return new ScriptSource(sourceText, SourceType.SCRIPT);
    }

    public static ScriptSource module(String sourceText) {
        return new ScriptSource(sourceText, SourceType.MODULE);
    }
}
