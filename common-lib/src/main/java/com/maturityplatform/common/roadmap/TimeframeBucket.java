package com.maturityplatform.common.roadmap;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimeframeBucket {
    QUICK_WIN("quick-win", "<3 months"),
    MID_TERM("mid-term", "3-9 months"),
    STRATEGIC("strategic", ">9 months");

    private final String key;
    private final String horizon;

    TimeframeBucket(String key, String horizon) {
        this.key = key;
        this.horizon = horizon;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String horizon() {
        return horizon;
    }
}
