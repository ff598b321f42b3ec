package tech.andrefsramos.offer_tracker.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.application.QueryLedgerUseCase;
import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;
import tech.andrefsramos.offer_tracker.core.ports.LedgerRepository;

import java.util.List;

public class QueryLedgerService implements QueryLedgerUseCase {

    private static final Logger log = LoggerFactory.getLogger(QueryLedgerService.class);
    private static final int MAX_SIZE = 500;

    private final LedgerRepository ledger;

    public QueryLedgerService(LedgerRepository ledger) {
        this.ledger = ledger;
    }

    @Override
    public List<LedgerRow> latest(String operator, int size) {
        String op = (operator == null || operator.isBlank()) ? null : operator.trim();
        int limit = Math.min(Math.max(size, 1), MAX_SIZE);
        List<LedgerRow> rows = ledger.findLatest(op, limit);
        log.debug("[Query] latest operator={} size={} -> {} linhas", op, limit, rows.size());
        return rows;
    }
}
