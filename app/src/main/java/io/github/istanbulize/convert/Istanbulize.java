package io.github.istanbulize.convert;

import io.github.istanbulize.parser.TreeSitterJsParser;
import io.github.istanbulize.report.FileCoverage;
import io.github.istanbulize.syntax.JsParser;
import io.github.istanbulize.syntax.ScriptSource;
import io.github.istanbulize.v8.ScriptCov;
import java.util.List;

/** Entry points for converting V8 script coverage into Istanbul file coverage. */
public final class Istanbulize {

    private Istanbulize() {}

    /** Parser used when none is given. */
    public static JsParser defaultParser() {
        return DefaultParserHolder.PARSER;
    }

    /** Converts a single V8 ScriptCoverage object to Istanbul file coverage. */
    public static FileCoverage istanbulize(IstanbulizeOptions options) {
        return istanbulize(options, defaultParser());
    }

    public static FileCoverage istanbulize(IstanbulizeOptions options, JsParser parser) {
        var accumulator = ScriptAccumulator.parse(options.source(), parser);
        accumulator.add(options.scriptCov());
        return accumulator.toReport();
    }

    /**
     * Parses {@code source} once and folds every snapshot into one report, in list order. All snapshots must belong to
     * the same script text.
     */
    public static FileCoverage merge(ScriptSource source, List<ScriptCov> snapshots) {
        return merge(source, snapshots, defaultParser());
    }

    public static FileCoverage merge(ScriptSource source, List<ScriptCov> snapshots, JsParser parser) {
        var accumulator = ScriptAccumulator.parse(source, parser);
        accumulator.addAll(snapshots);
        return accumulator.toReport();
    }

    // Defers loading the native TreeSitter library until a default parse is requested.
    private static final class DefaultParserHolder {
        private static final JsParser PARSER = new TreeSitterJsParser();
    }
}
