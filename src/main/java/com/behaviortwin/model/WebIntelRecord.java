package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One day of web intelligence. Parts that failed to parse are absent: {@code weather} is
 * {@code null}, malformed holidays and posts are left out of their lists.
 */
@Value
@Builder
public class WebIntelRecord {
    String date;
    WeatherInfo weather;
    List<HolidayEvent> holidayEvents;
    List<SocialPost> socialPosts;
    List<String> trendingTopics;
    List<String> marketInsights;
}
