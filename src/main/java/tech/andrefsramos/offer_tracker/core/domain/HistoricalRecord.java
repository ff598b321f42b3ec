package tech.andrefsramos.offer_tracker.core.domain;

import java.time.LocalDate;

public record HistoricalRecord(
        LocalDate date,
        String operator,
        String name,
        String validity,
        String details,
        String price
) {}
