package tech.andrefsramos.offer_tracker.core.domain;

/**
 * Classificação de uma oferta frente ao histórico. {@code remark} é o texto que vai
 * para o ledger; os flags permitem checar a mudança sem interpretar o texto.
 */
public record ChangeResult(
        ChangeCategory category,
        String remark,
        boolean priceChanged,
        boolean detailsChanged,
        String previousPrice
) {
    public boolean isNew() {
        return category == ChangeCategory.NEW;
    }

    public boolean isChanged() {
        return category == ChangeCategory.CHANGED;
    }
}
