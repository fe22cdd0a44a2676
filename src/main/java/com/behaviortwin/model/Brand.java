package com.behaviortwin.model;

public enum Brand {
    SEVEN_ELEVEN("7-11"),
    FAMILY_MART("FamilyMart"),
    OTHER("Other");

    private final String key;

    Brand(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
