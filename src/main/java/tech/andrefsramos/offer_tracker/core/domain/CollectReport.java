package tech.andrefsramos.offer_tracker.core.domain;

public record CollectReport(
        int sourcesOk,
        int sourcesFailed,
        int offers,
        int newOffers,
        int changed,
        int same,
        int rowsWritten
) {
    public static CollectReport empty() {
        return new CollectReport(0, 0, 0, 0, 0, 0, 0);
    }
}
