package tech.andrefsramos.offer_tracker.core.extraction;

import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;

import java.util.List;

/**
 * Contrato comum das estratégias de extração: operador + texto bruto da página entram,
 * ofertas estruturadas saem. Nenhuma implementação lança exceção por entrada malformada;
 * no pior caso devolve lista vazia.
 */
public interface ExtractionStrategy {

    String name();

    List<ExtractedOffer> extract(String operator, PageContent page);
}
