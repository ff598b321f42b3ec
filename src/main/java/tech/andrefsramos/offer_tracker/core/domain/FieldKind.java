package tech.andrefsramos.offer_tracker.core.domain;

public enum FieldKind {
    PRICE,
    DATA,
    MINUTES,
    SMS,
    VALIDITY,
    TEXT
}
