package tech.andrefsramos.offer_tracker.core.domain;

public enum Validity {
    DAILY("Daily"),
    WEEKLY("Weekly"),
    MONTHLY("Monthly"),
    THREE_DAYS("3 Days"),
    UNKNOWN("N/A");

    private final String label;

    Validity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
