package com.behaviortwin.repository;

import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the monthly behavior store, a line-delimited JSON file with one segment observation
 * per line. Every non-blank line ends up either as a kept record or as a skipped entry with
 * its reason; one bad line never aborts the batch.
 *
 * <p>Lines carrying an {@code event} field were appended by earlier simulation runs. They
 * are kept, flagged as artifacts, and parsed leniently.
 */
@Slf4j
@Repository
public class BehaviorRecordRepository {

    private static final String EVENT_FIELD = "event";

    private static final List<String> REQUIRED_FIELDS =
        List.of("timestamp", "group", "region", "brand_percentages", "avg_satisfaction");

    private final Path dataFile;
    private final JsonLinesReader reader = new JsonLinesReader();

    public BehaviorRecordRepository(
            @Value("${behavior.data.path}") String dataPath,
            @Value("${behavior.data.file:behavior_twin_monthly.jsonl}") String fileName) {
        this.dataFile = Path.of(dataPath).resolve(fileName);
        log.info("BehaviorRecordRepository reading from {}", dataFile.toAbsolutePath());
    }

    public Path getDataFile() {
        return dataFile;
    }

    public boolean isAvailable() {
        return Files.isRegularFile(dataFile) && Files.isReadable(dataFile);
    }

    public IngestionReport<BehaviorRecord> loadAll() {
        return reader.read(dataFile, this::parseRecord);
    }

    LineOutcome<BehaviorRecord> parseLine(int lineNumber, String line) {
        return reader.parseLine(lineNumber, line, this::parseRecord);
    }

    private LineOutcome<BehaviorRecord> parseRecord(int lineNumber, JsonNode json) {
        if (json.has(EVENT_FIELD)) {
            return LineOutcome.keep(toArtifact(json));
        }

        String missing = JsonLinesReader.firstMissing(json, REQUIRED_FIELDS);
        if (missing != null) {
            return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD, missing + " is required");
        }

        JsonNode brands = json.get("brand_percentages");
        if (!brands.isObject()) {
            return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD,
                                    "brand_percentages must be an object");
        }
        Map<String, Double> percentages = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = brands.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isNumber()) {
                return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD,
                                        "brand_percentages." + entry.getKey() + " must be a number");
            }
            double pct = entry.getValue().asDouble();
            if (pct < 0.0 || pct > 100.0) {
                return LineOutcome.skip(lineNumber, SkipReason.OUT_OF_RANGE,
                                        "brand_percentages." + entry.getKey() + " must be between 0 and 100");
            }
            percentages.put(entry.getKey(), pct);
        }

        JsonNode satisfaction = json.get("avg_satisfaction");
        if (!satisfaction.isNumber()) {
            return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD, "avg_satisfaction must be a number");
        }
        if (satisfaction.asDouble() < 0.0 || satisfaction.asDouble() > 1.0) {
            return LineOutcome.skip(lineNumber, SkipReason.OUT_OF_RANGE, "avg_satisfaction must be between 0 and 1");
        }

        return LineOutcome.keep(BehaviorRecord.builder()
            .timestamp(json.get("timestamp").asText())
            .persona(json.get("group").asText())
            .region(json.get("region").asText())
            .totalPersonas(JsonLinesReader.optionalInt(json, "total_personas"))
            .brandPercentages(percentages)
            .avgSatisfaction(satisfaction.asDouble())
            .digitalAdoptionRate(JsonLinesReader.optionalDouble(json, "digital_adoption_rate"))
            .gamificationEngagement(JsonLinesReader.optionalDouble(json, "gamification_engagement"))
            .efficiencyScore(JsonLinesReader.optionalDouble(json, "efficiency_score"))
            .keyInsights(JsonLinesReader.strings(json, "key_insights"))
            .simulationArtifact(false)
            .build());
    }

    private BehaviorRecord toArtifact(JsonNode json) {
        Map<String, Double> percentages = new LinkedHashMap<>();
        JsonNode brands = json.get("brand_percentages");
        if (brands != null && brands.isObject()) {
            brands.fields().forEachRemaining(e -> {
                if (e.getValue().isNumber()) {
                    percentages.put(e.getKey(), e.getValue().asDouble());
                }
            });
        }
        return BehaviorRecord.builder()
            .timestamp(JsonLinesReader.optionalText(json, "timestamp"))
            .persona(JsonLinesReader.optionalText(json, "group"))
            .region(JsonLinesReader.optionalText(json, "region"))
            .brandPercentages(percentages)
            .avgSatisfaction(json.path("avg_satisfaction").asDouble(0.0))
            .keyInsights(List.of())
            .simulationArtifact(true)
            .build();
    }
}
