package tech.andrefsramos.offer_tracker.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.offer_tracker.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.offer_tracker.core.domain.OfferSource;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.domain.RawBlock;
import tech.andrefsramos.offer_tracker.core.ports.PageTextPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/*
 * Finalidade

 * Provedor de texto de página sobre jsoup (HTML estático, sem renderização de JS).

 * Como funciona

 * - Baixa a página via {@link HttpFetch}.
 * - Para cada texto-âncora da fonte (ex.: "Consumer Price" na Zong, "MORE DETAILS" /
 *   "SUBSCRIBE" na Jazz) localiza os elementos cujo texto próprio contém a âncora e sobe
 *   ancestorDepth níveis até o card.
 * - Cards repetidos (mesmo elemento alcançado por âncoras diferentes) entram uma vez só,
 *   na ordem do documento em que foram encontrados.
 * - O texto do card é linearizado com quebra de linha em elementos de bloco e <br>,
 *   aproximando o texto visível que o navegador mostraria.
 */
@Component
public class JsoupPageTextAdapter implements PageTextPort {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageTextAdapter.class);

    private static final Set<String> HIDDEN_TAGS = Set.of("script", "style", "noscript", "template");

    @Value("${app.http.timeoutMs:25000}")
    private int timeoutMs = 25_000;

    @Value("${app.http.retries:2}")
    private int retries = 2;

    @Value("${app.http.backoffMs:2000}")
    private long backoffMs = 2_000;

    @Override
    public PageContent fetch(OfferSource source) {
        if (source == null || source.url() == null || source.url().isBlank()) {
            log.warn("[PageText] Fonte sem URL; ignorada. source={}", source);
            return null;
        }
        final long t0 = System.nanoTime();
        Document doc = HttpFetch.get(source.url(), timeoutMs, retries, backoffMs);
        if (doc == null) {
            return null;
        }
        PageContent page = toPageContent(source, doc);
        log.info("[PageText] operator={} url={} cards={} chars={} ({} ms)",
                source.operator(), source.url(), page.blocks().size(), page.fullText().length(),
                (System.nanoTime() - t0) / 1_000_000);
        return page;
    }

    public PageContent toPageContent(OfferSource source, Document doc) {
        Element root = doc.body() != null ? doc.body() : doc;
        String fullText = visibleText(root);

        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<RawBlock> blocks = new ArrayList<>();

        for (String anchor : source.anchorTexts()) {
            if (anchor == null || anchor.isBlank()) continue;
            for (Element hit : root.getElementsContainingOwnText(anchor.trim())) {
                Element card = climb(hit, source.ancestorDepth());
                if (!seen.add(card)) continue;

                RawBlock block = RawBlock.of(visibleText(card));
                if (!block.isEmpty()) blocks.add(block);
            }
        }

        if (blocks.isEmpty()) {
            log.warn("[PageText] Nenhum card encontrado operator={} âncoras={}", source.operator(), source.anchorTexts());
        }
        return new PageContent(source.operator(), source.url(), fullText, blocks);
    }

    private static Element climb(Element el, int depth) {
        Element card = el;
        for (int i = 0; i < depth && card.parent() != null; i++) {
            if (card.parent() instanceof Document) break;
            card = card.parent();
        }
        return card;
    }

    static String visibleText(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node instanceof Element e && HIDDEN_TAGS.contains(e.normalName())) {
                    return FilterResult.SKIP_ENTIRELY;
                }
                if (node instanceof TextNode t) {
                    sb.append(t.text());
                } else if (node instanceof Element e && (e.isBlock() || "br".equals(e.normalName()))) {
                    sb.append('\n');
                }
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                if (node instanceof Element e && e.isBlock()) {
                    sb.append('\n');
                }
                return FilterResult.CONTINUE;
            }
        }, root);
        return sb.toString();
    }
}
