package tech.andrefsramos.offer_tracker.core.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * Finalidade

 * Fotografia do histórico tirada antes de uma execução de coleta.
 * Para cada chave (operador, nome) fica a ÚLTIMA linha na ordem de inserção.
 * Não há ordenação por data: a ordem de append é a única noção de recência.
 * A chave é comparada por igualdade exata, sem normalização de nome.
 */
public final class LedgerSnapshot implements HistoryLookup {

    private final Map<Key, HistoricalRecord> latestByKey;

    private LedgerSnapshot(Map<Key, HistoricalRecord> latestByKey) {
        this.latestByKey = latestByKey;
    }

    public static LedgerSnapshot of(List<HistoricalRecord> appendOrdered) {
        Map<Key, HistoricalRecord> map = new HashMap<>();
        if (appendOrdered != null) {
            for (HistoricalRecord r : appendOrdered) {
                if (r == null) continue;
                map.put(new Key(r.operator(), r.name()), r);
            }
        }
        return new LedgerSnapshot(Map.copyOf(map));
    }

    @Override
    public Optional<HistoricalRecord> find(String operator, String name) {
        return Optional.ofNullable(latestByKey.get(new Key(operator, name)));
    }

    public int size() {
        return latestByKey.size();
    }

    private record Key(String operator, String name) {}
}
