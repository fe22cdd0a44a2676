package com.behaviortwin.repository;

import com.behaviortwin.exception.BehaviorDataNotFoundException;
import com.behaviortwin.exception.BehaviorDataReadException;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSONL file line by line. Blank lines are ignored, lines that are not JSON objects are
 * skipped as {@link SkipReason#INVALID_JSON}, everything else goes to the given parser.
 */
@Slf4j
class JsonLinesReader {

    @FunctionalInterface
    interface LineParser<T> {
        LineOutcome<T> parse(int lineNumber, JsonNode json);
    }

    private final ObjectMapper mapper = new ObjectMapper();

    ObjectMapper mapper() {
        return mapper;
    }

    <T> IngestionReport<T> read(Path file, LineParser<T> parser) {
        if (!Files.exists(file)) {
            throw new BehaviorDataNotFoundException(file);
        }
        List<T> records = new ArrayList<>();
        List<IngestionReport.SkippedRecord> skipped = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                LineOutcome<T> outcome = parseLine(lineNumber, line.strip(), parser);
                if (outcome.record() != null) {
                    records.add(outcome.record());
                } else {
                    skipped.add(outcome.skipped());
                    log.debug("Skipped line {} of {} | reason={} | {}",
                              lineNumber, file.getFileName(), outcome.skipped().reason(),
                              outcome.skipped().detail());
                }
            }
        } catch (IOException ex) {
            throw new BehaviorDataReadException(file, ex);
        }

        if (!skipped.isEmpty()) {
            log.warn("Skipped {} of {} records in {}",
                     skipped.size(), skipped.size() + records.size(), file.getFileName());
        }
        return new IngestionReport<>(records, skipped);
    }

    <T> LineOutcome<T> parseLine(int lineNumber, String line, LineParser<T> parser) {
        JsonNode json;
        try {
            json = mapper.readTree(line);
        } catch (JsonProcessingException ex) {
            return LineOutcome.skip(lineNumber, SkipReason.INVALID_JSON, ex.getOriginalMessage());
        }
        if (json == null || !json.isObject()) {
            return LineOutcome.skip(lineNumber, SkipReason.INVALID_JSON, "line is not a JSON object");
        }
        return parser.parse(lineNumber, json);
    }

    static String optionalText(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || node.isNull()) ? null : node.asText();
    }

    static Double optionalDouble(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || !node.isNumber()) ? null : node.asDouble();
    }

    static Integer optionalInt(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || !node.isNumber()) ? null : node.asInt();
    }

    static List<String> strings(JsonNode json, String key) {
        JsonNode node = json.get(key);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return List.copyOf(values);
    }

    /** First of {@code fields} that is absent or null, or {@code null} when all are present. */
    static String firstMissing(JsonNode json, List<String> fields) {
        for (String field : fields) {
            if (!json.hasNonNull(field)) {
                return field;
            }
        }
        return null;
    }
}
