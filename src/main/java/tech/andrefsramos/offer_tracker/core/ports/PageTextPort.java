package tech.andrefsramos.offer_tracker.core.ports;

import tech.andrefsramos.offer_tracker.core.domain.OfferSource;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;

public interface PageTextPort {
    /**
     * @return texto visível e cards da página, ou {@code null} quando a página não pôde ser obtida
     */
    PageContent fetch(OfferSource source);
}
