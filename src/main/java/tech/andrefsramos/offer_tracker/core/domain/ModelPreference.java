package tech.andrefsramos.offer_tracker.core.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/*
 * Finalidade

 * Lista ordenada de preferências de modelo (fragmentos de nome, ex.: "flash", "pro"),
 * resolvida contra os modelos que o serviço anuncia.

 * Regras
 *  - a primeira preferência contida (case-insensitive) em algum modelo disponível vence;
 *    entre modelos que casam a mesma preferência vale a ordem da listagem do serviço;
 *  - nenhuma preferência casa -> primeiro modelo disponível;
 *  - listagem vazia -> fallbackModel.
 */
public record ModelPreference(List<String> fragments, String fallbackModel) {

    public ModelPreference {
        fragments = fragments == null ? List.of() : fragments.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public String resolve(List<String> available) {
        if (available == null || available.isEmpty()) {
            return fallbackModel;
        }
        return match(available).orElse(available.get(0));
    }

    public Optional<String> match(List<String> available) {
        if (available == null) return Optional.empty();
        for (String fragment : fragments) {
            for (String model : available) {
                if (model != null && model.toLowerCase(Locale.ROOT).contains(fragment)) {
                    return Optional.of(model);
                }
            }
        }
        return Optional.empty();
    }
}
