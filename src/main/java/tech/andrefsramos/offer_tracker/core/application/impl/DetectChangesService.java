package tech.andrefsramos.offer_tracker.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.application.DetectChangesUseCase;
import tech.andrefsramos.offer_tracker.core.domain.ChangeResult;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.HistoryLookup;
import tech.andrefsramos.offer_tracker.core.domain.OfferChange;
import tech.andrefsramos.offer_tracker.core.domain.OfferChangePolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Percorre um lote de ofertas extraídas e compara cada uma com o histórico:
 *  1) Ignora itens nulos e ofertas com o nome sentinela ("Unknown Bundle").
 *  2) Aplica {@link OfferChangePolicy#compare(ExtractedOffer, HistoryLookup)}.
 *  3) Devolve oferta + resultado, na ordem de entrada, prontos para virar linha do ledger.

 * O lookup é somente-leitura; este serviço não grava nada.
 */
public class DetectChangesService implements DetectChangesUseCase {

    private static final Logger log = LoggerFactory.getLogger(DetectChangesService.class);

    private final OfferChangePolicy policy;

    public DetectChangesService(OfferChangePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    @Override
    public List<OfferChange> detect(List<ExtractedOffer> offers, HistoryLookup lookup) {
        final long t0 = System.nanoTime();

        if (offers == null || offers.isEmpty()) {
            log.info("[Detect] Lote vazio, nada a comparar.");
            return List.of();
        }
        Objects.requireNonNull(lookup, "lookup is required");

        final List<OfferChange> result = new ArrayList<>(offers.size());
        int processed = 0;
        int created = 0;
        int changed = 0;
        int unchanged = 0;
        int skipped = 0;

        for (ExtractedOffer incoming : offers) {
            processed++;

            if (incoming == null) {
                skipped++;
                log.warn("[Detect] Item nulo na posição {}; ignorado.", processed - 1);
                continue;
            }
            if (incoming.isUnknown()) {
                skipped++;
                log.debug("[Detect] Oferta sem nome (sentinela) operator={}; ignorada.", incoming.operator());
                continue;
            }

            ChangeResult change = policy.compare(incoming, lookup);
            result.add(new OfferChange(incoming, change));

            switch (change.category()) {
                case NEW -> created++;
                case CHANGED -> changed++;
                case SAME -> unchanged++;
            }
            if (log.isDebugEnabled()) {
                log.debug("[Detect] {} operator={} name='{}' remark='{}'",
                        change.category(), incoming.operator(), incoming.name(), change.remark());
            }
        }

        log.info("[Detect] Concluído: processed={}, new={}, changed={}, same={}, skipped={}, duração={} ms",
                processed, created, changed, unchanged, skipped, durMs(t0, System.nanoTime()));
        return result;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
