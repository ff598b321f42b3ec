package tech.andrefsramos.offer_tracker.core.application;

import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;

import java.util.List;

public interface QueryLedgerUseCase {
    List<LedgerRow> latest(String operator, int size);
}
