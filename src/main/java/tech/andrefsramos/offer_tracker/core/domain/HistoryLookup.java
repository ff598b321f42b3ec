package tech.andrefsramos.offer_tracker.core.domain;

import java.util.Optional;

/**
 * Consulta somente-leitura ao histórico: devolve o registro mais recente para a chave
 * exata (operador, nome).
 */
@FunctionalInterface
public interface HistoryLookup {

    Optional<HistoricalRecord> find(String operator, String name);

    static HistoryLookup empty() {
        return (operator, name) -> Optional.empty();
    }
}
