package tech.andrefsramos.offer_tracker.core.domain;

import java.time.LocalDate;

/*
 * Finalidade

 * Linha do ledger no formato estável de sete campos:
 * (date, operator, name, validity, details, price, remark).
 * A ordem dos campos é a mesma do histórico já gravado e não deve mudar.
 */
public record LedgerRow(
        LocalDate date,
        String operator,
        String name,
        String validity,
        String details,
        String price,
        String remark
) {
    public static LedgerRow of(LocalDate date, ExtractedOffer offer, ChangeResult change) {
        return new LedgerRow(date, offer.operator(), offer.name(), offer.validity(),
                offer.details(), offer.price(), change.remark());
    }
}
