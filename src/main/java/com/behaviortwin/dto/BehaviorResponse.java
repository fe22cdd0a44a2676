package com.behaviortwin.dto;

import com.behaviortwin.model.BehaviorRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class BehaviorResponse {
    boolean success;
    int count;
    List<BehaviorRecord> data;
    Map<String, Object> filtersApplied;
}
