package tech.andrefsramos.offer_tracker.core.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;

import java.util.List;
import java.util.stream.Collectors;

/*
 * Finalidade

 * Compõe estratégias em ordem de preferência: a primeira que devolver ao menos uma
 * oferta vence. A ordem (padrões antes de inferência, ou o inverso) vem da configuração.
 */
public class FallbackExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(FallbackExtractionStrategy.class);

    private final List<ExtractionStrategy> delegates;

    public FallbackExtractionStrategy(List<ExtractionStrategy> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
    }

    @Override
    public String name() {
        return delegates.stream().map(ExtractionStrategy::name).collect(Collectors.joining(">"));
    }

    @Override
    public List<ExtractedOffer> extract(String operator, PageContent page) {
        for (ExtractionStrategy s : delegates) {
            List<ExtractedOffer> offers;
            try {
                offers = s.extract(operator, page);
            } catch (RuntimeException e) {
                log.warn("[Fallback] Estratégia {} falhou para operator={}: {}", s.name(), operator, e.toString());
                continue;
            }
            if (offers != null && !offers.isEmpty()) {
                log.debug("[Fallback] Estratégia {} produziu {} ofertas para operator={}", s.name(), offers.size(), operator);
                return offers;
            }
            log.info("[Fallback] Estratégia {} sem ofertas para operator={}; tentando a próxima.", s.name(), operator);
        }
        return List.of();
    }
}
