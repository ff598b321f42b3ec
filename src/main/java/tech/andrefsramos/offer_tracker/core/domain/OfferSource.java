package tech.andrefsramos.offer_tracker.core.domain;

import java.util.List;

/**
 * Página de ofertas de uma operadora. Os cards são localizados pelos textos-âncora
 * (ex.: "Consumer Price", "SUBSCRIBE"), subindo {@code ancestorDepth} níveis até o card.
 */
public record OfferSource(
        String operator,
        String url,
        List<String> anchorTexts,
        int ancestorDepth,
        boolean enabled
) {
    public OfferSource {
        anchorTexts = anchorTexts == null ? List.of() : List.copyOf(anchorTexts);
        ancestorDepth = Math.max(ancestorDepth, 0);
    }
}
