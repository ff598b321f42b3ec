package tech.andrefsramos.offer_tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import tech.andrefsramos.offer_tracker.adapters.outbound.inference.GeminiInferenceClientAdapter;
import tech.andrefsramos.offer_tracker.core.application.*;
import tech.andrefsramos.offer_tracker.core.application.impl.*;
import tech.andrefsramos.offer_tracker.core.domain.ModelPreference;
import tech.andrefsramos.offer_tracker.core.domain.OfferChangePolicy;
import tech.andrefsramos.offer_tracker.core.domain.OfferSource;
import tech.andrefsramos.offer_tracker.core.domain.RetryPolicy;
import tech.andrefsramos.offer_tracker.core.extraction.*;
import tech.andrefsramos.offer_tracker.core.ports.InferenceClientPort;
import tech.andrefsramos.offer_tracker.core.ports.LedgerRepository;
import tech.andrefsramos.offer_tracker.core.ports.PageTextPort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/*
 * Finalidade

 * Orquestra a composição dos casos de uso e portas, criando beans Spring com dependências
 * explicitadas via construtor. Parâmetros vêm do application.yml / env e são saneados aqui,
 * com WARN quando um valor fora da faixa é ajustado.

 * Visão Geral dos Beans

 * - PatternExtractor / InferenceExtractor: as duas estratégias de extração. A de inferência
 *   só existe com app.inference.enabled=true.
 * - ExtractionStrategy (primário): composição por fallback na ordem de app.extraction.order.
 * - OfferChangePolicy + DetectChangesUseCase: remark de cada oferta frente ao histórico.
 * - CollectOffersUseCase: execução de coleta por fonte configurada em app.sources.
 * - QueryLedgerUseCase / PreviewExtractionUseCase: leitura do ledger e pré-visualização.
 */
@Configuration
@EnableConfigurationProperties(SourcesProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= Infra ============================= */

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    /* ============================= Estratégias de extração ============================= */

    @Bean
    PatternExtractor patternExtractor() {
        log.info("[AppConfig] PatternExtractor inicializado");
        return new PatternExtractor();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.inference", name = "enabled", havingValue = "true")
    InferenceClientPort inferenceClientPort(
            ObjectMapper objectMapper,
            @Value("${app.inference.baseUrl:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.inference.apiKey:}") String apiKey,
            @Value("${app.inference.modelPreferences:flash,pro}") String preferences,
            @Value("${app.inference.defaultModel:gemini-1.5-flash}") String defaultModel,
            @Value("${app.inference.connectTimeoutMs:10000}") int connectTimeoutMs,
            @Value("${app.inference.readTimeoutMs:60000}") int readTimeoutMs
    ) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[AppConfig] app.inference.enabled=true mas app.inference.apiKey está vazio. Chamadas de inferência falharão.");
        }
        List<String> fragments = Arrays.stream(preferences.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        ModelPreference preference = new ModelPreference(fragments, defaultModel);

        log.info("[AppConfig] InferenceClientPort (Gemini) inicializado baseUrl={} preferências={} padrão={}",
                baseUrl, fragments, defaultModel);
        return new GeminiInferenceClientAdapter(objectMapper, baseUrl, apiKey, preference, connectTimeoutMs, readTimeoutMs);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.inference", name = "enabled", havingValue = "true")
    InferenceExtractor inferenceExtractor(
            InferenceClientPort client,
            ObjectMapper objectMapper,
            @Value("${app.extraction.inference.minTextLength:100}") int minTextLength,
            @Value("${app.extraction.inference.maxAttempts:3}") int maxAttempts,
            @Value("${app.extraction.inference.retryDelayMs:60000}") long retryDelayMs,
            @Value("${app.extraction.inference.maxPromptChars:30000}") int maxPromptChars
    ) {
        if (maxAttempts < 1) {
            log.warn("[AppConfig] app.extraction.inference.maxAttempts={} inválido. Ajustando para 1.", maxAttempts);
            maxAttempts = 1;
        }
        if (retryDelayMs < 0) {
            log.warn("[AppConfig] app.extraction.inference.retryDelayMs={} inválido. Ajustando para 0.", retryDelayMs);
            retryDelayMs = 0;
        }
        if (maxPromptChars < 1000) {
            log.warn("[AppConfig] app.extraction.inference.maxPromptChars={} muito baixo. Ajustando para 1000.", maxPromptChars);
            maxPromptChars = 1000;
        }

        RetryPolicy retry = RetryPolicy.fixed(maxAttempts, Duration.ofMillis(retryDelayMs));
        log.info("[AppConfig] InferenceExtractor inicializado (minTextLength={}, maxAttempts={}, retryDelayMs={}, maxPromptChars={})",
                minTextLength, maxAttempts, retryDelayMs, maxPromptChars);
        return new InferenceExtractor(client, new OfferPromptBuilder(maxPromptChars),
                new InferenceResponseParser(objectMapper), retry, Sleeper.threadSleep(), minTextLength);
    }

    @Bean
    @Primary
    ExtractionStrategy extractionStrategy(
            PatternExtractor patternExtractor,
            ObjectProvider<InferenceExtractor> inferenceExtractor,
            @Value("${app.extraction.order:pattern,inference}") String order
    ) {
        Map<String, ExtractionStrategy> available = strategies(patternExtractor, inferenceExtractor.getIfAvailable());
        List<ExtractionStrategy> chain = new ArrayList<>();

        for (String raw : order.split(",")) {
            String key = raw.trim().toLowerCase(Locale.ROOT);
            if (key.isEmpty()) continue;
            ExtractionStrategy s = available.get(key);
            if (s == null) {
                log.warn("[AppConfig] Estratégia '{}' em app.extraction.order não está disponível; ignorada. Disponíveis={}",
                        key, available.keySet());
                continue;
            }
            if (!chain.contains(s)) chain.add(s);
        }

        if (chain.isEmpty()) {
            log.warn("[AppConfig] Nenhuma estratégia válida em app.extraction.order='{}'. Usando '{}'.", order, PatternExtractor.NAME);
            chain.add(patternExtractor);
        }

        FallbackExtractionStrategy bean = new FallbackExtractionStrategy(chain);
        log.info("[AppConfig] ExtractionStrategy inicializada ordem={}", bean.name());
        return bean;
    }

    /* ============================= Detecção de mudanças ============================= */

    @Bean
    OfferChangePolicy offerChangePolicy(@Value("${app.ledger.sameLabel:Same}") String sameLabel) {
        OfferChangePolicy policy = new OfferChangePolicy(sameLabel);
        log.info("[AppConfig] OfferChangePolicy inicializada (sameLabel='{}')", policy.sameLabel());
        return policy;
    }

    @Bean
    DetectChangesUseCase detectChangesUseCase(OfferChangePolicy policy) {
        return new DetectChangesService(policy);
    }

    /* ============================= CollectOffersUseCase ============================= */

    @Bean
    CollectOffersUseCase collectOffersUseCase(
            SourcesProperties sourcesProperties,
            PageTextPort pageTextPort,
            ExtractionStrategy extractionStrategy,
            DetectChangesUseCase detectChangesUseCase,
            LedgerRepository ledgerRepository,
            Clock clock
    ) {
        final long t0 = System.nanoTime();
        try {
            List<OfferSource> sources = sourcesProperties.toOfferSources();
            long enabled = sources.stream().filter(OfferSource::enabled).count();
            if (enabled == 0) {
                log.warn("[AppConfig] Nenhuma fonte habilitada (app.sources). Coleta ficará inoperante.");
            }

            CollectOffersUseCase bean = new CollectOffersService(
                    sources, pageTextPort, extractionStrategy, detectChangesUseCase, ledgerRepository, clock);

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] CollectOffersUseCase inicializado (fontes={}, habilitadas={}) tookMs={}ms",
                    sources.size(), enabled, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar CollectOffersUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= Consulta / pré-visualização ============================= */

    @Bean
    QueryLedgerUseCase queryLedgerUseCase(LedgerRepository ledgerRepository) {
        return new QueryLedgerService(ledgerRepository);
    }

    @Bean
    PreviewExtractionUseCase previewExtractionUseCase(
            PatternExtractor patternExtractor,
            ObjectProvider<InferenceExtractor> inferenceExtractor,
            ExtractionStrategy extractionStrategy,
            DetectChangesUseCase detectChangesUseCase,
            LedgerRepository ledgerRepository
    ) {
        return new PreviewExtractionService(
                strategies(patternExtractor, inferenceExtractor.getIfAvailable()),
                extractionStrategy, detectChangesUseCase, ledgerRepository);
    }

    private static Map<String, ExtractionStrategy> strategies(PatternExtractor pattern, InferenceExtractor inference) {
        Map<String, ExtractionStrategy> map = new LinkedHashMap<>();
        map.put(pattern.name(), pattern);
        if (inference != null) map.put(inference.name(), inference);
        return map;
    }
}
