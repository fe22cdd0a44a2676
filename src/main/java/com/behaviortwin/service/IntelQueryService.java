package com.behaviortwin.service;

import com.behaviortwin.dto.WebIntelResponse;
import com.behaviortwin.exception.NoWebIntelException;
import com.behaviortwin.model.DailyIntelReport;
import com.behaviortwin.model.WebIntelRecord;
import com.behaviortwin.repository.IntelRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class IntelQueryService {

    private final IntelRepository repository;

    /** Daily reports in file order, optionally for a single date; unparsable reports are skipped. */
    public List<DailyIntelReport> dailyIntel(LocalDate date, int limit) {
        return repository.loadDailyIntel().records().stream()
            .filter(r -> date == null || date.toString().equals(r.getDate()))
            .limit(limit)
            .toList();
    }

    /**
     * Web intel for the given date, or the first record in the feed when no date is given.
     *
     * @throws NoWebIntelException when no record matches
     */
    public WebIntelResponse webIntel(LocalDate date) {
        WebIntelRecord record = repository.loadWebIntel().records().stream()
            .filter(r -> date == null || date.toString().equals(r.getDate()))
            .findFirst()
            .orElseThrow(() -> new NoWebIntelException(date));

        return WebIntelResponse.builder()
            .success(true)
            .date(record.getDate())
            .weather(record.getWeather())
            .holidayEvents(record.getHolidayEvents())
            .socialPosts(record.getSocialPosts())
            .trendingTopics(record.getTrendingTopics())
            .marketInsights(record.getMarketInsights())
            .build();
    }
}
