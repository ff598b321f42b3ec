package tech.andrefsramos.offer_tracker.core.domain;

import java.time.LocalDate;

public record OfferChange(ExtractedOffer offer, ChangeResult change) {

    public LedgerRow toLedgerRow(LocalDate date) {
        return LedgerRow.of(date, offer, change);
    }
}
