package io.github.istanbulize.cli;

import io.github.istanbulize.config.IstanbulizeSettings;
import io.github.istanbulize.convert.CoverageMismatchException;
import io.github.istanbulize.convert.InvalidScriptCovException;
import io.github.istanbulize.convert.Istanbulize;
import io.github.istanbulize.convert.ModuleWrapper;
import io.github.istanbulize.convert.ScriptAccumulator;
import io.github.istanbulize.json.CoverageJson;
import io.github.istanbulize.syntax.ScriptSource;
import io.github.istanbulize.syntax.SourceParseException;
import io.github.istanbulize.syntax.SourceType;
import io.github.istanbulize.v8.ScriptCov;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli injects the options and the command model before call()
@CommandLine.Command(
        name = "istanbulize",
        mixinStandardHelpOptions = true,
        description = "Converts V8 coverage of a JavaScript file into an Istanbul coverage report.")
public final class IstanbulizeCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(IstanbulizeCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONVERSION_FAILED = 1;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--source", required = true, description = "JavaScript file the coverage belongs to.")
    private Path sourcePath;

    @CommandLine.Option(
            names = "--coverage",
            required = true,
            description = "V8 coverage JSON (a ScriptCoverage or a NODE_V8_COVERAGE document). Can be repeated.")
    private List<Path> coveragePaths = new ArrayList<>();

    @CommandLine.Option(names = "--module", description = "Parse the source as an ES module.")
    private boolean module;

    @CommandLine.Option(
            names = "--wrapper",
            description = "Wrapper the engine added around the source: none, node, or <prefixLength>,<suffixLength>.")
    @Nullable
    private String wrapper;

    @CommandLine.Option(names = "--url", description = "Take only scripts with this url from coverage documents.")
    @Nullable
    private String url;

    @CommandLine.Option(names = "--output", description = "Report file. Defaults to standard output.")
    @Nullable
    private Path outputPath;

    @CommandLine.Option(names = "--config", description = "Properties file overriding the default settings.")
    @Nullable
    private Path configPath;

    @CommandLine.Option(names = "--compact", description = "Write the report on a single line.")
    private boolean compact;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new IstanbulizeCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var err = spec.commandLine().getErr();

        IstanbulizeSettings settings;
        try {
            settings = resolveSettings();
        } catch (IOException e) {
            err.println("Error reading config file: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        logger.info(
                "Converting coverage of {} ({}, wrapper {})", sourcePath, settings.sourceType(), settings.wrapper());

        String sourceText;
        try {
            sourceText = Files.readString(sourcePath);
        } catch (IOException e) {
            err.println("Error reading source file " + sourcePath + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        var snapshots = new ArrayList<ScriptCov>();
        for (var coveragePath : coveragePaths) {
            List<ScriptCov> scripts;
            try {
                scripts = CoverageJson.readCoverage(coveragePath);
            } catch (IOException e) {
                err.println("Error reading coverage file " + coveragePath + ": " + e.getMessage());
                return EXIT_USAGE;
            }
            var selected = selectScripts(scripts, url, sourcePath);
            if (selected.isEmpty()) {
                logger.warn("No script coverage for {} in {}", sourcePath, coveragePath);
            }
            snapshots.addAll(selected);
        }
        if (snapshots.isEmpty()) {
            err.println("No coverage found for " + sourcePath);
            return EXIT_CONVERSION_FAILED;
        }

        try {
            var source = new ScriptSource(sourceText, settings.sourceType());
            var accumulator = ScriptAccumulator.parse(source, Istanbulize.defaultParser());
            for (var snapshot : snapshots) {
                accumulator.add(settings.wrapper().unwrapScriptCov(snapshot));
            }
            var report = accumulator.toReport();
            if (outputPath != null) {
                CoverageJson.writeReports(List.of(report), outputPath, settings.prettyPrint());
                logger.info("Wrote coverage report to {}", outputPath);
            } else {
                CoverageJson.writeReports(List.of(report), spec.commandLine().getOut(), settings.prettyPrint());
            }
        } catch (SourceParseException | CoverageMismatchException | InvalidScriptCovException e) {
            logger.debug("Conversion of {} failed", sourcePath, e);
            err.println("Conversion failed: " + e.getMessage());
            return EXIT_CONVERSION_FAILED;
        } catch (IOException e) {
            err.println("Error writing report: " + e.getMessage());
            return EXIT_USAGE;
        }
        return EXIT_OK;
    }

    private IstanbulizeSettings resolveSettings() throws IOException {
        var settings = IstanbulizeSettings.load(configPath);
        if (module) {
            settings = settings.withSourceType(SourceType.MODULE);
        }
        if (wrapper != null) {
            settings = settings.withWrapper(ModuleWrapper.parse(wrapper));
        }
        if (compact) {
            settings = settings.withPrettyPrint(false);
        }
        return settings;
    }

    /**
     * Picks the scripts of {@code source} out of a coverage document: those with the given url, otherwise the only
     * script of the document, otherwise those whose url ends with the source file name.
     */
    static List<ScriptCov> selectScripts(List<ScriptCov> scripts, @Nullable String url, Path source) {
        if (url != null) {
            return scripts.stream().filter(s -> s.url().equals(url)).toList();
        }
        if (scripts.size() == 1) {
            return scripts;
        }
        var fileName = source.getFileName().toString();
        return scripts.stream()
                .filter(s -> s.url().equals(fileName)
                        || s.url().endsWith("/" + fileName)
                        || s.url().endsWith("\\" + fileName))
                .toList();
    }
}
