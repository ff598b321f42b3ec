package tech.andrefsramos.offer_tracker.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.application.DetectChangesUseCase;
import tech.andrefsramos.offer_tracker.core.application.PreviewExtractionUseCase;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.LedgerSnapshot;
import tech.andrefsramos.offer_tracker.core.domain.OfferChange;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.extraction.ExtractionStrategy;
import tech.andrefsramos.offer_tracker.core.ports.LedgerRepository;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/*
 * Finalidade

 * Executa extração + comparação sobre um texto enviado pelo usuário, sem gravar no ledger.
 * Útil para calibrar as regras de padrão contra o texto real de uma página.
 */
public class PreviewExtractionService implements PreviewExtractionUseCase {

    private static final Logger log = LoggerFactory.getLogger(PreviewExtractionService.class);

    private final Map<String, ExtractionStrategy> strategies;
    private final ExtractionStrategy defaultStrategy;
    private final DetectChangesUseCase detectChanges;
    private final LedgerRepository ledger;

    public PreviewExtractionService(
            Map<String, ExtractionStrategy> strategies,
            ExtractionStrategy defaultStrategy,
            DetectChangesUseCase detectChanges,
            LedgerRepository ledger
    ) {
        this.strategies = strategies != null ? Map.copyOf(strategies) : Map.of();
        this.defaultStrategy = defaultStrategy;
        this.detectChanges = detectChanges;
        this.ledger = ledger;
    }

    @Override
    public List<OfferChange> preview(String operator, String text, String strategy) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator é obrigatório");
        }
        ExtractionStrategy s = resolve(strategy);
        PageContent page = PageContent.fromText(operator.trim(), text);

        List<ExtractedOffer> offers = s.extract(operator.trim(), page);
        LedgerSnapshot snapshot = LedgerSnapshot.of(ledger.findAll());
        List<OfferChange> changes = detectChanges.detect(offers, snapshot);

        log.info("[Preview] operator={} estratégia={} blocos={} ofertas={}",
                operator, s.name(), page.blocks().size(), changes.size());
        return changes;
    }

    private ExtractionStrategy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return defaultStrategy;
        }
        ExtractionStrategy s = strategies.get(strategy.trim().toLowerCase(Locale.ROOT));
        if (s == null) {
            throw new IllegalArgumentException("Estratégia não configurada: " + strategy + " (disponíveis: " + strategies.keySet() + ")");
        }
        return s;
    }
}
