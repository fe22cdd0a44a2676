package com.behaviortwin.model;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {
    PRICE_CHANGE("price_change", "電價/價格變動", "模擬價格變化對消費行為的影響"),
    PROMOTION("promotion", "促銷活動", "模擬折扣、點數等促銷效果"),
    COMPETITION("competition", "競合變化", "模擬競爭對手動作"),
    EXTERNAL("external", "外部因素", "天氣、節慶等外部因素");

    public static final String ID_PATTERN = "price_change|promotion|competition|external";

    private final String id;
    private final String displayName;
    private final String description;

    EventType(String id, String displayName, String description) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<EventType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.id.equals(id))
            .findFirst();
    }
}
