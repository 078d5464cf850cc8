package io.github.istanbulize.convert;

import com.google.common.base.Splitter;
import io.github.istanbulize.v8.FunctionCov;
import io.github.istanbulize.v8.RangeCov;
import io.github.istanbulize.v8.ScriptCov;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Text an engine adds around a module body before evaluating it, described by the lengths of its prefix and suffix.
 * Coverage of a wrapped module has offsets into the wrapped text; {@link #unwrapScriptCov} and
 * {@link #unwrapSourceText} shift both back onto the bare file.
 */
public record ModuleWrapper(int prefixLength, int suffixLength) {

    /** Node's CommonJS wrapper, {@code require('module').wrapper}. */
    public static final ModuleWrapper NODE_COMMONJS =
            of("(function (exports, require, module, __filename, __dirname) { ", "\n});");

    public static final ModuleWrapper NONE = new ModuleWrapper(0, 0);

    public ModuleWrapper {
        if (prefixLength < 0 || suffixLength < 0) {
            throw new IllegalArgumentException(
                    "Wrapper lengths must not be negative: " + prefixLength + "," + suffixLength);
        }
    }

    public static ModuleWrapper of(String prefix, String suffix) {
        return new ModuleWrapper(prefix.length(), suffix.length());
    }

    /**
     * Parses {@code none}, {@code node} (the CommonJS wrapper) or {@code <prefixLength>,<suffixLength>}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ModuleWrapper parse(String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("none")) {
            return NONE;
        }
        if (normalized.equals("node")) {
            return NODE_COMMONJS;
        }
        var parts = Splitter.on(',').trimResults().splitToList(normalized);
        if (parts.size() != 2) {
            throw new IllegalArgumentException(
                    "Wrapper must be 'none', 'node' or '<prefixLength>,<suffixLength>', got: " + value);
        }
        try {
            return new ModuleWrapper(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid wrapper lengths: " + value, e);
        }
    }

    public boolean isNone() {
        return prefixLength == 0 && suffixLength == 0;
    }

    /**
     * Strips the wrapper from wrapped source text.
     *
     * @throws IllegalArgumentException if the text is shorter than the wrapper
     */
    public String unwrapSourceText(String sourceText) {
        if (sourceText.length() < prefixLength + suffixLength) {
            throw new IllegalArgumentException("Source text of length " + sourceText.length()
                    + " cannot hold a wrapper of " + prefixLength + "+" + suffixLength + " characters");
        }
        return sourceText.substring(prefixLength, sourceText.length() - suffixLength);
    }

    /**
     * Shifts every range onto the unwrapped body. The body ends {@code suffixLength} before the end of the script-level
     * function ({@code functions[0]}). Ranges are clamped to the body, empty ranges are dropped, and so are functions
     * left without any range, such as functions defined entirely inside the wrapper text. The wrapper function itself
     * covers the body and is kept, clamped to it.
     *
     * @throws InvalidScriptCovException if {@code functions[0]} has no range
     */
    public ScriptCov unwrapScriptCov(ScriptCov scriptCov) {
        if (scriptCov.functions().isEmpty()) {
            return scriptCov;
        }
        var rootRange = scriptCov.functions().get(0).rootRange();
        if (rootRange == null) {
            throw new InvalidScriptCovException("expected `functions[0].ranges.length > 0`");
        }
        int bodyStart = prefixLength;
        int bodyEnd = rootRange.endOffset() - suffixLength;
        int bodyLength = bodyEnd - bodyStart;

        var functions = new ArrayList<FunctionCov>();
        for (var function : scriptCov.functions()) {
            var ranges = new ArrayList<RangeCov>();
            for (var range : function.ranges()) {
                int startOffset = Math.max(range.startOffset() - bodyStart, 0);
                int endOffset = Math.min(range.endOffset() - bodyStart, bodyLength);
                if (startOffset < endOffset) {
                    ranges.add(new RangeCov(startOffset, endOffset, range.count()));
                }
            }
            if (!ranges.isEmpty()) {
                functions.add(new FunctionCov(function.functionName(), ranges, function.isBlockCoverage()));
            }
        }
        return scriptCov.withFunctions(functions);
    }
}
