package tech.andrefsramos.offer_tracker.core.domain;

public enum ChangeCategory {
    NEW,
    SAME,
    CHANGED
}
