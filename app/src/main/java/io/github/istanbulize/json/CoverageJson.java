package io.github.istanbulize.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.istanbulize.report.FileCoverage;
import io.github.istanbulize.v8.ProcessCov;
import io.github.istanbulize.v8.ScriptCov;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson codecs for V8 coverage input and Istanbul report output. Properties the engine adds and this tool does not
 * model ({@code timestamp}, {@code source-map-cache}, ...) are ignored.
 */
public final class CoverageJson {
    private static final ObjectMapper objectMapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CoverageJson() {}

    public static ScriptCov readScriptCov(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ScriptCov.class);
    }

    public static ProcessCov readProcessCov(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ProcessCov.class);
    }

    /**
     * Reads either a process coverage document ({@code {"result": [...]}}) or a single script coverage object, and
     * returns the scripts it contains.
     */
    public static List<ScriptCov> readCoverage(String json) throws JsonProcessingException {
        JsonNode tree = objectMapper.readTree(json);
        if (tree == null || !tree.isObject()) {
            throw new JsonMappingFailure("Expected a JSON object with either `result` or `functions`");
        }
        if (tree.has("result")) {
            return objectMapper.treeToValue(tree, ProcessCov.class).result();
        }
        return List.of(objectMapper.treeToValue(tree, ScriptCov.class));
    }

    public static List<ScriptCov> readCoverage(Path file) throws IOException {
        return readCoverage(Files.readString(file));
    }

    public static String writeReport(FileCoverage report, boolean pretty) throws JsonProcessingException {
        return writer(pretty).writeValueAsString(report);
    }

    public static FileCoverage readReport(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, FileCoverage.class);
    }

    /**
     * Writes {@code reports} as one object keyed by report path, the shape of Istanbul's coverage-final.json. The
     * writer is flushed, not closed.
     */
    public static void writeReports(List<FileCoverage> reports, Writer out, boolean pretty) throws IOException {
        out.write(writer(pretty).writeValueAsString(byPath(reports)));
        out.write(System.lineSeparator());
        out.flush();
    }

    public static void writeReports(List<FileCoverage> reports, Path file, boolean pretty) throws IOException {
        writer(pretty).writeValue(file.toFile(), byPath(reports));
    }

    private static Map<String, FileCoverage> byPath(List<FileCoverage> reports) {
        var byPath = new LinkedHashMap<String, FileCoverage>();
        for (var report : reports) {
            byPath.put(report.path(), report);
        }
        return byPath;
    }

    private static ObjectWriter writer(boolean pretty) {
        return pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
    }

    private static final class JsonMappingFailure extends JsonProcessingException {
        JsonMappingFailure(String message) {
            super(message);
        }
    }
}
