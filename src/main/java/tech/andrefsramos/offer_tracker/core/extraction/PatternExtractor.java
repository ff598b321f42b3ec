package tech.andrefsramos.offer_tracker.core.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.FieldClassifier;
import tech.andrefsramos.offer_tracker.core.domain.LineClassification;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.domain.RawBlock;
import tech.andrefsramos.offer_tracker.core.domain.Validity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/*
 * Finalidade

 * Extração determinística por regras: cada card (RawBlock) vira uma ExtractedOffer.

 * Como funciona (uma passada pelas linhas, na ordem original)

 * - Preço: a PRIMEIRA linha com marcador de moeda vira o preço; linhas com marcador
 *   nunca entram em detalhes, validade ou nome.
 * - Detalhes: linhas com dados/minutos/SMS são acumuladas (uma vez cada) e não podem ser nome.
 * - Validade: testada em toda linha restante; a ÚLTIMA linha com palavra-chave vence.
 * - Nome: primeira linha restante com mais de 3 caracteres que não contenha
 *   "subscribe" nem "consumer price". Sem candidata -> "Unknown Bundle".

 * Blocos que terminam com o nome sentinela são descartados em extract(operator, page).
 */
public class PatternExtractor implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PatternExtractor.class);

    public static final String NAME = "pattern";

    private static final int MIN_NAME_LENGTH = 4;
    private static final List<String> NAME_BLOCKLIST = List.of("subscribe", "consumer price");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ExtractedOffer> extract(String operator, PageContent page) {
        Objects.requireNonNull(operator, "operator is required");
        if (page == null || page.blocks().isEmpty()) {
            log.debug("[Pattern] Nenhum bloco para operator={}.", operator);
            return List.of();
        }

        final long t0 = System.nanoTime();
        List<ExtractedOffer> offers = new ArrayList<>();
        int discarded = 0;

        for (RawBlock block : page.blocks()) {
            ExtractedOffer offer = extract(operator, block);
            if (offer.isUnknown()) {
                discarded++;
                continue;
            }
            offers.add(offer);
        }

        log.info("[Pattern] operator={} blocos={} ofertas={} descartados={} ({} ms)",
                operator, page.blocks().size(), offers.size(), discarded, (System.nanoTime() - t0) / 1_000_000);
        return offers;
    }

    public ExtractedOffer extract(String operator, RawBlock block) {
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(block, "block is required");

        String price = ExtractedOffer.NOT_AVAILABLE;
        boolean priceTaken = false;
        Validity validity = Validity.UNKNOWN;
        String name = ExtractedOffer.UNKNOWN_NAME;
        List<String> details = new ArrayList<>();

        for (String line : block.lines()) {
            LineClassification c = FieldClassifier.classify(line);

            if (c.isPrice()) {
                if (!priceTaken) {
                    price = c.priceToken();
                    priceTaken = true;
                }
                continue;
            }

            if (c.validityHint().isPresent()) {
                validity = c.validityHint().get();
            }

            if (c.isDetail()) {
                details.add(c.line());
                continue;
            }

            // nome pode vir antes ou depois do preço; só a primeira candidata conta
            if (ExtractedOffer.UNKNOWN_NAME.equals(name) && isNameCandidate(c.line())) {
                name = c.line();
            }
        }

        String joined = details.isEmpty() ? ExtractedOffer.CHECK_SITE : String.join(", ", details);
        return new ExtractedOffer(operator, name, price, validity.label(), joined);
    }

    private static boolean isNameCandidate(String line) {
        if (line.length() < MIN_NAME_LENGTH) return false;
        String lower = line.toLowerCase(Locale.ROOT);
        for (String blocked : NAME_BLOCKLIST) {
            if (lower.contains(blocked)) return false;
        }
        return true;
    }
}
