package tech.andrefsramos.offer_tracker.core.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.domain.RetryPolicy;
import tech.andrefsramos.offer_tracker.core.ports.InferenceClientPort;
import tech.andrefsramos.offer_tracker.core.ports.InferenceException;
import tech.andrefsramos.offer_tracker.core.ports.RateLimitedException;

import java.util.List;
import java.util.Objects;

/*
 * Finalidade

 * Estratégia alternativa de extração: delega o reconhecimento dos campos a um serviço
 * externo de inferência (texto -> lista JSON de ofertas).

 * Como funciona

 * 1) Texto com menos de minTextLength caracteres é tratado como página que não
 *    renderizou: nenhuma chamada é feita e o resultado é vazio.
 * 2) Monta o prompt ({@link OfferPromptBuilder}) e chama o serviço.
 * 3) Sinal de limite de taxa ({@link RateLimitedException}): espera o intervalo fixo da
 *    {@link RetryPolicy} e repete o MESMO prompt, até maxAttempts chamadas no total.
 * 4) Qualquer outra falha (erro do serviço, payload malformado após o reparo) encerra a
 *    chamada com lista vazia, sem retentar.

 * A espera bloqueia a thread chamadora e não tem cancelamento; quem precisar de prazo
 * deve envolver a chamada externamente.
 */
public class InferenceExtractor implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(InferenceExtractor.class);

    public static final String NAME = "inference";

    private final InferenceClientPort client;
    private final OfferPromptBuilder promptBuilder;
    private final InferenceResponseParser parser;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final int minTextLength;

    public InferenceExtractor(
            InferenceClientPort client,
            OfferPromptBuilder promptBuilder,
            InferenceResponseParser parser,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            int minTextLength
    ) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder is required");
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.minTextLength = Math.max(minTextLength, 0);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ExtractedOffer> extract(String operator, PageContent page) {
        return extract(operator, page == null ? null : page.fullText());
    }

    public List<ExtractedOffer> extract(String operator, String pageText) {
        Objects.requireNonNull(operator, "operator is required");

        int len = pageText == null ? 0 : pageText.trim().length();
        if (len < minTextLength) {
            log.warn("[Inference] Texto curto demais para operator={} (len={}, min={}). Página provavelmente não renderizou; chamada ignorada.",
                    operator, len, minTextLength);
            return List.of();
        }

        final String prompt = promptBuilder.build(operator, pageText);
        final long t0 = System.nanoTime();

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                log.info("[Inference] Chamando serviço operator={} tentativa={}/{} promptChars={}",
                        operator, attempt, retryPolicy.maxAttempts(), prompt.length());

                String response = client.generate(prompt);
                List<ExtractedOffer> offers = parser.parse(operator, response);

                log.info("[Inference] operator={} ofertas={} tentativas={} ({} ms)",
                        operator, offers.size(), attempt, (System.nanoTime() - t0) / 1_000_000);
                return offers;

            } catch (RateLimitedException e) {
                if (!retryPolicy.canRetry(attempt)) {
                    log.error("[Inference] Limite de taxa persistente para operator={} após {} tentativas. Desistindo.",
                            operator, attempt);
                    return List.of();
                }
                log.warn("[Inference] Limite de taxa para operator={} (tentativa {}/{}). Aguardando {} ms.",
                        operator, attempt, retryPolicy.maxAttempts(), retryPolicy.delay().toMillis());
                if (!pause()) {
                    log.warn("[Inference] Espera interrompida para operator={}; retornando vazio.", operator);
                    return List.of();
                }
            } catch (InferenceException e) {
                log.error("[Inference] Falha terminal para operator={} tentativa={}: {}", operator, attempt, e.getMessage());
                return List.of();
            } catch (RuntimeException e) {
                log.error("[Inference] Erro inesperado para operator={} tentativa={}: {}", operator, attempt, e.getMessage(), e);
                return List.of();
            }
        }
        return List.of();
    }

    private boolean pause() {
        try {
            sleeper.sleep(retryPolicy.delay());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
