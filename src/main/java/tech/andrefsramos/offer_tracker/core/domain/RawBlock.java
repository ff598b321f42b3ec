package tech.andrefsramos.offer_tracker.core.domain;

import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Uma região de texto da página que, visualmente, representa um único card de oferta.
 * As linhas chegam já aparadas e nunca vazias; a ordem original é preservada porque
 * as regras de extração dependem dela (primeiro preço, última validade, primeiro nome).
 */
public record RawBlock(List<String> lines) {

    public RawBlock {
        List<String> clean = new ArrayList<>();
        if (lines != null) {
            for (String l : lines) {
                if (l == null) continue;
                String t = l.trim();
                if (!t.isEmpty()) clean.add(t);
            }
        }
        lines = List.copyOf(clean);
    }

    public static RawBlock of(String text) {
        if (text == null || text.isBlank()) return new RawBlock(List.of());
        return new RawBlock(List.of(text.split("\\R")));
    }

    public static RawBlock of(String... lines) {
        return new RawBlock(List.of(lines));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
