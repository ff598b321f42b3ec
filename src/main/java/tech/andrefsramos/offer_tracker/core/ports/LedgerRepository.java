package tech.andrefsramos.offer_tracker.core.ports;

import tech.andrefsramos.offer_tracker.core.domain.HistoricalRecord;
import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;

import java.util.List;

public interface LedgerRepository {
    /** Todo o histórico, na ordem em que foi gravado. */
    List<HistoricalRecord> findAll();
    void appendAll(List<LedgerRow> rows);
    List<LedgerRow> findLatest(String operator, int limit);
}
