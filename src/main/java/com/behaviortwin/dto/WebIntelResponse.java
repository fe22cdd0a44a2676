package com.behaviortwin.dto;

import com.behaviortwin.model.HolidayEvent;
import com.behaviortwin.model.SocialPost;
import com.behaviortwin.model.WeatherInfo;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WebIntelResponse {
    boolean success;
    String date;
    WeatherInfo weather;
    List<HolidayEvent> holidayEvents;
    List<SocialPost> socialPosts;
    List<String> trendingTopics;
    List<String> marketInsights;
}
