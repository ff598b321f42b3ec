package tech.andrefsramos.offer_tracker.core.domain;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resultado da classificação de uma linha. Uma linha de preço não carrega nenhuma
 * outra classificação; fora isso, detalhe e validade são independentes.
 */
public record LineClassification(String line, String priceToken, Set<FieldKind> detailKinds, Validity validity) {

    public LineClassification {
        detailKinds = detailKinds == null || detailKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(detailKinds));
    }

    public boolean isPrice() {
        return priceToken != null;
    }

    public boolean isDetail() {
        return !detailKinds.isEmpty();
    }

    public Optional<Validity> validityHint() {
        return Optional.ofNullable(validity);
    }

    public Set<FieldKind> kinds() {
        if (isPrice()) return Set.of(FieldKind.PRICE);
        EnumSet<FieldKind> all = EnumSet.noneOf(FieldKind.class);
        all.addAll(detailKinds);
        if (validity != null) all.add(FieldKind.VALIDITY);
        if (all.isEmpty()) all.add(FieldKind.TEXT);
        return all;
    }
}
