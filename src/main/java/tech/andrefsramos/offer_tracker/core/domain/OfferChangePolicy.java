package tech.andrefsramos.offer_tracker.core.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/*
 * Finalidade

 * Compara uma oferta recém-extraída com o último registro do histórico para a mesma
 * chave (operador, nome) e produz o remark:
 *  - sem registro                -> "New Offer"
 *  - preço e detalhes iguais     -> "Same" (rótulo configurável, ex.: "Same as yesterday")
 *  - qualquer campo diferente    -> "Changed: Price: 250->300, Details Updated"

 * Preço e detalhes são comparados por igualdade de string após trim. Uma oferta
 * renomeada não é reconhecida: aparece como "New Offer".
 */
public final class OfferChangePolicy {

    public static final String NEW_OFFER = "New Offer";
    public static final String DEFAULT_SAME_LABEL = "Same";
    public static final String CHANGED_PREFIX = "Changed: ";
    public static final String DETAILS_UPDATED = "Details Updated";

    private final String sameLabel;

    public OfferChangePolicy() {
        this(DEFAULT_SAME_LABEL);
    }

    public OfferChangePolicy(String sameLabel) {
        this.sameLabel = (sameLabel == null || sameLabel.isBlank()) ? DEFAULT_SAME_LABEL : sameLabel.trim();
    }

    public ChangeResult compare(ExtractedOffer offer, HistoryLookup lookup) {
        Objects.requireNonNull(offer, "offer is required");
        Objects.requireNonNull(lookup, "lookup is required");
        Optional<HistoricalRecord> previous = lookup.find(offer.operator(), offer.name());
        return compare(offer, previous == null ? Optional.empty() : previous);
    }

    public ChangeResult compare(ExtractedOffer offer, Optional<HistoricalRecord> previous) {
        Objects.requireNonNull(offer, "offer is required");
        Objects.requireNonNull(previous, "previous is required");
        if (previous.isEmpty()) {
            return new ChangeResult(ChangeCategory.NEW, NEW_OFFER, false, false, null);
        }

        HistoricalRecord last = previous.get();
        String oldPrice = trim(last.price());
        String newPrice = trim(offer.price());
        boolean priceChanged = !oldPrice.equals(newPrice);
        boolean detailsChanged = !trim(last.details()).equals(trim(offer.details()));

        if (!priceChanged && !detailsChanged) {
            return new ChangeResult(ChangeCategory.SAME, sameLabel, false, false, oldPrice);
        }

        List<String> fragments = new ArrayList<>(2);
        if (priceChanged) fragments.add("Price: " + oldPrice + "->" + newPrice);
        if (detailsChanged) fragments.add(DETAILS_UPDATED);

        return new ChangeResult(ChangeCategory.CHANGED, CHANGED_PREFIX + String.join(", ", fragments),
                priceChanged, detailsChanged, oldPrice);
    }

    public String sameLabel() {
        return sameLabel;
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
