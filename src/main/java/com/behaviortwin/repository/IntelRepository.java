package com.behaviortwin.repository;

import com.behaviortwin.model.DailyIntelReport;
import com.behaviortwin.model.HolidayEvent;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;
import com.behaviortwin.model.SocialPost;
import com.behaviortwin.model.WeatherInfo;
import com.behaviortwin.model.WebIntelRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the two intelligence feeds: the daily intel reports stored next to the behavior data,
 * and the daily web intel (weather, holidays, social posts) kept in its own directory.
 */
@Slf4j
@Repository
public class IntelRepository {

    /** Posts beyond this many per day are ignored. */
    public static final int MAX_SOCIAL_POSTS = 20;

    private static final List<String> DAILY_REQUIRED_FIELDS = List.of(
        "date", "daily_intelligence_summary", "behavioral_twin_report", "incentive_analysis", "metadata");
    private static final List<String> WEATHER_REQUIRED_FIELDS =
        List.of("location", "temperature", "humidity", "description", "is_rainy");
    private static final List<String> HOLIDAY_REQUIRED_FIELDS =
        List.of("name", "description", "start_date", "end_date", "category");
    private static final List<String> POST_REQUIRED_FIELDS =
        List.of("platform", "board", "title", "url", "author", "timestamp", "likes", "comments");
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final Path dailyIntelFile;
    private final Path webIntelFile;
    private final JsonLinesReader reader = new JsonLinesReader();

    public IntelRepository(
            @Value("${behavior.data.path}") String dataPath,
            @Value("${behavior.intel.daily-file:daily_intel_report.jsonl}") String dailyFile,
            @Value("${behavior.web-intel.path:${behavior.data.path}}") String webIntelPath,
            @Value("${behavior.web-intel.file:daily_web_intel.jsonl}") String webFile) {
        this.dailyIntelFile = Path.of(dataPath).resolve(dailyFile);
        this.webIntelFile = Path.of(webIntelPath).resolve(webFile);
        log.info("IntelRepository reading from {} and {}",
                 dailyIntelFile.toAbsolutePath(), webIntelFile.toAbsolutePath());
    }

    public Path getDailyIntelFile() {
        return dailyIntelFile;
    }

    public Path getWebIntelFile() {
        return webIntelFile;
    }

    public IngestionReport<DailyIntelReport> loadDailyIntel() {
        return reader.read(dailyIntelFile, this::parseDailyIntel);
    }

    public IngestionReport<WebIntelRecord> loadWebIntel() {
        return reader.read(webIntelFile, this::parseWebIntel);
    }

    LineOutcome<DailyIntelReport> parseDailyIntel(int lineNumber, JsonNode json) {
        String missing = JsonLinesReader.firstMissing(json, DAILY_REQUIRED_FIELDS);
        if (missing != null) {
            return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD, missing + " is required");
        }
        for (String section : List.of("behavioral_twin_report", "incentive_analysis", "metadata")) {
            if (!json.get(section).isObject()) {
                return LineOutcome.skip(lineNumber, SkipReason.MISSING_FIELD, section + " must be an object");
            }
        }
        return LineOutcome.keep(DailyIntelReport.builder()
            .date(json.get("date").asText())
            .dailyIntelligenceSummary(json.get("daily_intelligence_summary").asText())
            .behavioralTwinReport(toMap(json.get("behavioral_twin_report")))
            .anomalyDetection(JsonLinesReader.optionalText(json, "anomaly_detection"))
            .incentiveAnalysis(toMap(json.get("incentive_analysis")))
            .metadata(toMap(json.get("metadata")))
            .build());
    }

    // Web intel lines are kept whole; only their parts are validated.
    LineOutcome<WebIntelRecord> parseWebIntel(int lineNumber, JsonNode json) {
        List<HolidayEvent> holidays = new ArrayList<>();
        JsonNode holidayNodes = json.path("holiday_events");
        if (holidayNodes.isArray()) {
            for (JsonNode node : holidayNodes) {
                HolidayEvent holiday = toHoliday(node);
                if (holiday != null) {
                    holidays.add(holiday);
                }
            }
        }

        List<SocialPost> posts = new ArrayList<>();
        JsonNode postNodes = json.path("social_posts");
        int postCount = postNodes.isArray() ? Math.min(postNodes.size(), MAX_SOCIAL_POSTS) : 0;
        for (int i = 0; i < postCount; i++) {
            SocialPost post = toPost(postNodes.get(i));
            if (post != null) {
                posts.add(post);
            }
        }

        return LineOutcome.keep(WebIntelRecord.builder()
            .date(json.path("date").asText(""))
            .weather(toWeather(json.get("weather")))
            .holidayEvents(List.copyOf(holidays))
            .socialPosts(List.copyOf(posts))
            .trendingTopics(JsonLinesReader.strings(json, "trending_topics"))
            .marketInsights(JsonLinesReader.strings(json, "market_insights"))
            .build());
    }

    private WeatherInfo toWeather(JsonNode node) {
        if (node == null || !node.isObject() || JsonLinesReader.firstMissing(node, WEATHER_REQUIRED_FIELDS) != null
                || !node.get("temperature").isNumber() || !node.get("humidity").isNumber()
                || !node.get("is_rainy").isBoolean()) {
            log.debug("Ignoring malformed weather entry");
            return null;
        }
        return WeatherInfo.builder()
            .location(node.get("location").asText())
            .temperature(node.get("temperature").asDouble())
            .humidity(node.get("humidity").asInt())
            .description(node.get("description").asText())
            .rainy(node.get("is_rainy").asBoolean())
            .comfortIndex(JsonLinesReader.optionalDouble(node, "comfort_index"))
            .build();
    }

    private HolidayEvent toHoliday(JsonNode node) {
        if (!node.isObject() || JsonLinesReader.firstMissing(node, HOLIDAY_REQUIRED_FIELDS) != null) {
            log.debug("Ignoring malformed holiday entry");
            return null;
        }
        return HolidayEvent.builder()
            .name(node.get("name").asText())
            .description(node.get("description").asText())
            .startDate(node.get("start_date").asText())
            .endDate(node.get("end_date").asText())
            .category(node.get("category").asText())
            .relatedKeywords(JsonLinesReader.strings(node, "related_keywords"))
            .impact(JsonLinesReader.optionalText(node, "impact"))
            .build();
    }

    private SocialPost toPost(JsonNode node) {
        if (!node.isObject() || JsonLinesReader.firstMissing(node, POST_REQUIRED_FIELDS) != null
                || !node.get("likes").isNumber() || !node.get("comments").isNumber()) {
            log.debug("Ignoring malformed social post");
            return null;
        }
        return SocialPost.builder()
            .platform(node.get("platform").asText())
            .board(node.get("board").asText())
            .title(node.get("title").asText())
            .url(node.get("url").asText())
            .author(node.get("author").asText())
            .timestamp(node.get("timestamp").asText())
            .likes(node.get("likes").asInt())
            .comments(node.get("comments").asInt())
            .keywords(JsonLinesReader.strings(node, "keywords"))
            .sentiment(node.path("sentiment").asInt(0))
            .build();
    }

    private Map<String, Object> toMap(JsonNode node) {
        return reader.mapper().convertValue(node, OBJECT_MAP);
    }
}
