package tech.andrefsramos.offer_tracker.core.application;

import tech.andrefsramos.offer_tracker.core.domain.CollectReport;

public interface CollectOffersUseCase {
    CollectReport collectForOperator(String operator);
    CollectReport collectAllEnabled();
}
