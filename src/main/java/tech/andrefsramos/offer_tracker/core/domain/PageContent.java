package tech.andrefsramos.offer_tracker.core.domain;

import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Texto visível de uma página de ofertas de uma operadora, em duas formas:
 *  - fullText: o texto corrido da página (usado pela estratégia de inferência);
 *  - blocks:   os cards já recortados pelo provedor de texto (usados pela estratégia de padrões).
 */
public record PageContent(String operator, String url, String fullText, List<RawBlock> blocks) {

    public PageContent {
        fullText = fullText == null ? "" : fullText;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    /**
     * Monta o conteúdo a partir de texto livre: cada parágrafo (separado por linha em branco)
     * vira um bloco.
     */
    public static PageContent fromText(String operator, String text) {
        String full = text == null ? "" : text;
        List<RawBlock> blocks = new ArrayList<>();
        for (String paragraph : full.split("\\R\\s*\\R")) {
            RawBlock b = RawBlock.of(paragraph);
            if (!b.isEmpty()) blocks.add(b);
        }
        return new PageContent(operator, null, full, blocks);
    }
}
