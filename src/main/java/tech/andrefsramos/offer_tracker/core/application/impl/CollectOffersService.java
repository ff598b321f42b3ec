package tech.andrefsramos.offer_tracker.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.application.CollectOffersUseCase;
import tech.andrefsramos.offer_tracker.core.application.DetectChangesUseCase;
import tech.andrefsramos.offer_tracker.core.domain.CollectReport;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;
import tech.andrefsramos.offer_tracker.core.domain.LedgerSnapshot;
import tech.andrefsramos.offer_tracker.core.domain.OfferChange;
import tech.andrefsramos.offer_tracker.core.domain.OfferSource;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.extraction.ExtractionStrategy;
import tech.andrefsramos.offer_tracker.core.ports.LedgerRepository;
import tech.andrefsramos.offer_tracker.core.ports.PageTextPort;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Orquestra uma execução de coleta:
 *  1) Lê o histórico UMA vez e monta o {@link LedgerSnapshot} antes de qualquer extração,
 *     de modo que ofertas novas desta execução nunca se vejam como histórico.
 *  2) Para cada fonte habilitada: obtém o texto da página ({@link PageTextPort}),
 *     extrai ofertas ({@link ExtractionStrategy}) e delega a comparação a
 *     {@link DetectChangesUseCase}.
 *  3) Grava todas as linhas de uma vez no ledger, com a data da execução.

 * Falha em uma fonte é registrada e a execução segue para a próxima.
 * Sem histórico legível a execução é abortada: gravar sem comparar marcaria tudo como "New Offer".
 */
public class CollectOffersService implements CollectOffersUseCase {

    private static final Logger log = LoggerFactory.getLogger(CollectOffersService.class);

    private final List<OfferSource> sources;
    private final PageTextPort pageText;
    private final ExtractionStrategy strategy;
    private final DetectChangesUseCase detectChanges;
    private final LedgerRepository ledger;
    private final Clock clock;

    public CollectOffersService(
            List<OfferSource> sources,
            PageTextPort pageText,
            ExtractionStrategy strategy,
            DetectChangesUseCase detectChanges,
            LedgerRepository ledger,
            Clock clock
    ) {
        this.sources = sources != null ? List.copyOf(sources) : List.of();
        this.pageText = Objects.requireNonNull(pageText, "pageText is required");
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
        this.detectChanges = Objects.requireNonNull(detectChanges, "detectChanges is required");
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
    }

    @Override
    public CollectReport collectForOperator(String operator) {
        if (operator == null || operator.isBlank()) {
            log.warn("[Collect] Operador vazio/nulo. Ignorando execução.");
            return CollectReport.empty();
        }
        final String op = operator.trim();
        List<OfferSource> selected = sources.stream()
                .filter(OfferSource::enabled)
                .filter(s -> s.operator() != null && s.operator().equalsIgnoreCase(op))
                .toList();

        if (selected.isEmpty()) {
            log.warn("[Collect] Nenhuma fonte habilitada para operator={}. Fontes registradas={}", op, sources.size());
            return CollectReport.empty();
        }
        return run(selected, op);
    }

    @Override
    public CollectReport collectAllEnabled() {
        List<OfferSource> selected = sources.stream().filter(OfferSource::enabled).toList();
        if (selected.isEmpty()) {
            log.warn("[CollectAll] Nenhuma fonte habilitada. Verifique app.sources.*");
            return CollectReport.empty();
        }
        return run(selected, "all");
    }

    private CollectReport run(List<OfferSource> selected, String label) {
        final long t0 = System.nanoTime();
        log.info("[Collect] Iniciando coleta scope={} fontes={} estratégia={}", label, selected.size(), strategy.name());

        final LedgerSnapshot snapshot;
        try {
            snapshot = LedgerSnapshot.of(ledger.findAll());
            log.info("[Collect] Histórico carregado: chaves={}", snapshot.size());
        } catch (Exception e) {
            log.error("[Collect] Falha ao ler o histórico; coleta abortada. Causa={}", e.getMessage(), e);
            return new CollectReport(0, selected.size(), 0, 0, 0, 0, 0);
        }

        final LocalDate today = LocalDate.now(clock);
        final List<LedgerRow> rows = new ArrayList<>();
        int ok = 0, fail = 0, offers = 0, created = 0, changed = 0, same = 0;

        for (OfferSource source : selected) {
            final long ti = System.nanoTime();
            try {
                PageContent page = pageText.fetch(source);
                if (page == null) {
                    fail++;
                    log.warn("[Collect] Página indisponível operator={} url={}", source.operator(), source.url());
                    continue;
                }

                List<ExtractedOffer> extracted = strategy.extract(source.operator(), page);
                List<OfferChange> changes = detectChanges.detect(extracted, snapshot);

                for (OfferChange c : changes) {
                    rows.add(c.toLedgerRow(today));
                    switch (c.change().category()) {
                        case NEW -> created++;
                        case CHANGED -> changed++;
                        case SAME -> same++;
                    }
                }
                offers += changes.size();
                ok++;
                log.info("[Collect] operator={} ofertas={} ({} ms)", source.operator(), changes.size(), durMs(ti, System.nanoTime()));
            } catch (Exception e) {
                fail++;
                log.error("[Collect] Falha ao coletar operator={} url={}. Causa={}",
                        source.operator(), source.url(), e.getMessage(), e);
            }
        }

        int written = 0;
        if (rows.isEmpty()) {
            log.warn("[Collect] Coleta terminou sem ofertas scope={}; nada a gravar.", label);
        } else {
            try {
                ledger.appendAll(rows);
                written = rows.size();
            } catch (Exception e) {
                log.error("[Collect] Falha ao gravar {} linhas no ledger. Causa={}", rows.size(), e.getMessage(), e);
            }
        }

        CollectReport report = new CollectReport(ok, fail, offers, created, changed, same, written);
        log.info("[Collect] FIM scope={} report={} ({} ms totais)", label, report, durMs(t0, System.nanoTime()));
        return report;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
