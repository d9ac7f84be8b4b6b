package com.shlokmestry.gatekeeper.usage;

import java.util.Optional;

public enum StatusClass {
    STATUS_2XX("sum2xx", "2xx"),
    STATUS_3XX("sum3xx", "3xx"),
    STATUS_4XX("sum4xx", "4xx"),
    STATUS_429("sum429", "429"),
    STATUS_5XX("sum5xx", "5xx");

    private final String field;
    private final String label;

    StatusClass(String field, String label) {
        this.field = field;
        this.label = label;
    }

    public String field() {
        return field;
    }

    public String label() {
        return label;
    }

    // empty for 1xx and anything outside 100-599
    public static Optional<StatusClass> of(int status) {
        if (status == 429) return Optional.of(STATUS_429);
        if (status >= 200 && status < 300) return Optional.of(STATUS_2XX);
        if (status >= 300 && status < 400) return Optional.of(STATUS_3XX);
        if (status >= 400 && status < 500) return Optional.of(STATUS_4XX);
        if (status >= 500 && status < 600) return Optional.of(STATUS_5XX);
        return Optional.empty();
    }
}
