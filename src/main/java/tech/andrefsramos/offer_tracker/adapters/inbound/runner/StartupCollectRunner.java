package tech.andrefsramos.offer_tracker.adapters.inbound.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.andrefsramos.offer_tracker.core.application.CollectOffersUseCase;
import tech.andrefsramos.offer_tracker.core.domain.CollectReport;

/**
 * StartupCollectRunner

 * Executa uma coleta completa assim que a aplicação sobe (app.runOnStartup=true).
 * O agendamento das execuções fica fora da aplicação (cron, CI, etc.).
 */
@Component
@ConditionalOnProperty(prefix = "app", name = "runOnStartup", havingValue = "true")
public class StartupCollectRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupCollectRunner.class);
    private final CollectOffersUseCase collect;

    public StartupCollectRunner(CollectOffersUseCase collect) {this.collect = collect;}

    @Override
    public void run(ApplicationArguments args) {
        long start = System.nanoTime();
        log.info("StartupCollectRunner: início da coleta de inicialização (todas as fontes habilitadas).");

        try {
            CollectReport report = collect.collectAllEnabled();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("StartupCollectRunner: coleta concluída (elapsedMs={} ms) report={}", elapsedMs, report);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("StartupCollectRunner: erro durante a coleta de inicialização (elapsedMs={} ms).", elapsedMs, ex);
        }
    }
}
