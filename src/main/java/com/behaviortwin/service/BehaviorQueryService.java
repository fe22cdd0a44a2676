package com.behaviortwin.service;

import com.behaviortwin.dto.BehaviorResponse;
import com.behaviortwin.dto.BehaviorSummaryResponse;
import com.behaviortwin.exception.NoBehaviorDataException;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.Brand;
import com.behaviortwin.repository.BehaviorRecordRepository;
import com.behaviortwin.util.SegmentAliases;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side queries over the stored behavior records. Simulation artifacts are never
 * returned or counted.
 */
@Service
@RequiredArgsConstructor
public class BehaviorQueryService {

    private final BehaviorRecordRepository repository;

    public BehaviorResponse find(String persona, String region,
                                 LocalDate startDate, LocalDate endDate, int limit) {
        List<BehaviorRecord> matches = observations().stream()
            .filter(r -> SegmentAliases.personaMatches(r.getPersona(), persona))
            .filter(r -> SegmentAliases.regionMatches(r.getRegion(), region))
            .filter(r -> withinRange(r, startDate, endDate))
            .limit(limit)
            .toList();

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("persona", persona);
        filters.put("region", region);
        filters.put("startDate", startDate);
        filters.put("endDate", endDate);
        filters.put("limit", limit);

        return BehaviorResponse.builder()
            .success(true)
            .count(matches.size())
            .data(matches)
            .filtersApplied(filters)
            .build();
    }

    public BehaviorSummaryResponse summary() {
        List<BehaviorRecord> records = observations();
        if (records.isEmpty()) {
            throw new NoBehaviorDataException();
        }
        int total = records.size();

        double avgSatisfaction = records.stream()
            .mapToDouble(BehaviorRecord::getAvgSatisfaction)
            .sum() / total;

        Map<String, Double> brandAverages = new LinkedHashMap<>();
        for (Brand brand : Brand.values()) {
            double sum = records.stream().mapToDouble(r -> r.brandShares().get(brand)).sum();
            brandAverages.put(brand.getKey(), sum / total);
        }
        String topBrand = null;
        for (Map.Entry<String, Double> entry : brandAverages.entrySet()) {
            if (topBrand == null || entry.getValue() > brandAverages.get(topBrand)) {
                topBrand = entry.getKey();
            }
        }

        Map<String, Integer> personas = new LinkedHashMap<>();
        Map<String, Integer> regions = new LinkedHashMap<>();
        for (BehaviorRecord record : records) {
            personas.merge(record.getPersona(), 1, Integer::sum);
            regions.merge(record.getRegion(), 1, Integer::sum);
        }

        return BehaviorSummaryResponse.builder()
            .totalRecords(total)
            .averageSatisfaction(Math.round(avgSatisfaction * 1000.0) / 1000.0)
            .topBrand(topBrand)
            .brandDistributionSummary(brandAverages)
            .personaBreakdown(personas)
            .regionBreakdown(regions)
            .build();
    }

    private List<BehaviorRecord> observations() {
        return repository.loadAll().records().stream()
            .filter(r -> !r.isSimulationArtifact())
            .toList();
    }

    // Records whose timestamp carries no ISO date are kept regardless of the range.
    private boolean withinRange(BehaviorRecord record, LocalDate startDate, LocalDate endDate) {
        if (startDate == null && endDate == null) {
            return true;
        }
        String ts = record.getTimestamp();
        if (ts == null) {
            return true;
        }
        LocalDate date;
        try {
            date = LocalDate.parse(ts.length() > 10 ? ts.substring(0, 10) : ts);
        } catch (DateTimeParseException ex) {
            return true;
        }
        if (startDate != null && date.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !date.isAfter(endDate);
    }
}
