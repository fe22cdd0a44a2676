package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WeatherInfo {
    String location;
    double temperature;
    int humidity;
    String description;
    boolean rainy;
    Double comfortIndex;
}
