package tech.andrefsramos.offer_tracker.core.application;

import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.HistoryLookup;
import tech.andrefsramos.offer_tracker.core.domain.OfferChange;

import java.util.List;

public interface DetectChangesUseCase {
    List<OfferChange> detect(List<ExtractedOffer> offers, HistoryLookup lookup);
}
