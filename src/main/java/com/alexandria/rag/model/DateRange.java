package com.alexandria.rag.model;

import java.time.OffsetDateTime;

public record DateRange(OffsetDateTime from, OffsetDateTime to) {
    public DateRange {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Date range start " + from + " is after end " + to);
        }
    }
}
