package tech.andrefsramos.offer_tracker.core.application;

import tech.andrefsramos.offer_tracker.core.domain.OfferChange;

import java.util.List;

public interface PreviewExtractionUseCase {
    /**
     * Extrai ofertas de um texto avulso e calcula o remark contra o histórico, sem gravar nada.
     *
     * @param strategy nome da estratégia ("pattern", "inference"); nulo usa a estratégia padrão
     * @throws IllegalArgumentException se a estratégia não estiver configurada
     */
    List<OfferChange> preview(String operator, String text, String strategy);
}
