package io.github.istanbulize.convert;

import io.github.istanbulize.syntax.ScriptSource;
import io.github.istanbulize.syntax.SourceType;
import io.github.istanbulize.v8.ScriptCov;

/**
 * Input of a one-shot conversion. The source text must be wrapped exactly like the coverage offsets are.
 *
 * @param sourceText the script text
 * @param sourceType parse goal
 * @param scriptCov coverage of the script
 */
public record IstanbulizeOptions(String sourceText, SourceType sourceType, ScriptCov scriptCov) {

    public ScriptSource source() {
        return new ScriptSource(sourceText, sourceType);
    }
}
