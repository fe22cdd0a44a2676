package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HolidayEvent {
    String name;
    String description;
    String startDate;
    String endDate;
    String category;
    List<String> relatedKeywords;
    String impact;
}
