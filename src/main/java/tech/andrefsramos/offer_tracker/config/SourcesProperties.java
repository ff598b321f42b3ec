package tech.andrefsramos.offer_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import tech.andrefsramos.offer_tracker.core.domain.OfferSource;

import java.util.List;

/*
 * Finalidade

 * Lista de páginas de ofertas a coletar (app.sources[*] no application.yml).
 * ancestorDepth padrão = 3 (âncora -> pai -> avô -> bisavô), como nos cards da Zong e da Jazz.
 */
@ConfigurationProperties(prefix = "app")
public record SourcesProperties(List<Source> sources) {

    public static final int DEFAULT_ANCESTOR_DEPTH = 3;

    public SourcesProperties {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<OfferSource> toOfferSources() {
        return sources.stream()
                .map(s -> new OfferSource(
                        s.operator(),
                        s.url(),
                        s.anchors(),
                        s.ancestorDepth() == null ? DEFAULT_ANCESTOR_DEPTH : s.ancestorDepth(),
                        s.enabled() == null || s.enabled()))
                .toList();
    }

    public record Source(String operator, String url, List<String> anchors, Integer ancestorDepth, Boolean enabled) {}
}
