package tech.andrefsramos.offer_tracker.adapters.outbound.scrapers;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.OfferSource;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.extraction.PatternExtractor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Recorte de cards a partir de HTML estático, sem rede.
 */
class JsoupPageTextAdapterTest {

    private static final String JAZZ_HTML = "<html><body>"
            + "<header><nav>Prepaid Bundles</nav></header>"
            + "<div class=\"cards\">"
            + "<div class=\"card\"><h3>Weekly Super Card</h3><ul><li>10GB Data</li><li>500 Mins</li></ul>"
            + "<p>Rs. 250 Incl. Tax</p><div class=\"actions\"><a href=\"#\">MORE DETAILS</a> <a href=\"#\">SUBSCRIBE</a></div></div>"
            + "<div class=\"card\"><h3>Monthly Hybrid</h3><ul><li>5000 Mins</li><li>1000 SMS</li></ul>"
            + "<p>Rs. 1,200 Incl. Tax</p><div class=\"actions\"><a href=\"#\">MORE DETAILS</a> <a href=\"#\">SUBSCRIBE</a></div></div>"
            + "</div>"
            + "<script>var label = 'SUBSCRIBE';</script>"
            + "</body></html>";

    private final JsoupPageTextAdapter adapter = new JsoupPageTextAdapter();

    private static OfferSource jazz(List<String> anchors, int depth) {
        return new OfferSource("Jazz", "https://jazz.test/prepaid", anchors, depth, true);
    }

    @Test
    void climbsFromAnchorToCardAndDeduplicates() {
        Document doc = Jsoup.parse(JAZZ_HTML);

        PageContent page = adapter.toPageContent(jazz(List.of("MORE DETAILS", "SUBSCRIBE"), 2), doc);

        assertThat(page.operator()).isEqualTo("Jazz");
        assertThat(page.blocks()).hasSize(2);
        assertThat(page.blocks().get(0).lines()).containsExactly(
                "Weekly Super Card", "10GB Data", "500 Mins", "Rs. 250 Incl. Tax", "MORE DETAILS SUBSCRIBE");
        assertThat(page.blocks().get(1).lines()).first().isEqualTo("Monthly Hybrid");
    }

    @Test
    void cardsFeedPatternExtraction() {
        PageContent page = adapter.toPageContent(jazz(List.of("SUBSCRIBE"), 2), Jsoup.parse(JAZZ_HTML));

        List<ExtractedOffer> offers = new PatternExtractor().extract("Jazz", page);

        assertThat(offers).containsExactly(
                new ExtractedOffer("Jazz", "Weekly Super Card", "250", "Weekly", "10GB Data, 500 Mins"),
                new ExtractedOffer("Jazz", "Monthly Hybrid", "1,200", "Monthly", "5000 Mins, 1000 SMS"));
    }

    @Test
    void fullTextSkipsScripts() {
        PageContent page = adapter.toPageContent(jazz(List.of("SUBSCRIBE"), 2), Jsoup.parse(JAZZ_HTML));

        assertThat(page.fullText()).contains("Prepaid Bundles").contains("Weekly Super Card");
        assertThat(page.fullText()).doesNotContain("var label");
    }

    @Test
    void missingAnchorYieldsNoCards() {
        PageContent page = adapter.toPageContent(jazz(List.of("Consumer Price"), 3), Jsoup.parse(JAZZ_HTML));

        assertThat(page.blocks()).isEmpty();
        assertThat(page.fullText()).isNotBlank();
    }

    @Test
    void lineBreaksFollowBlockElementsAndBr() {
        Document doc = Jsoup.parse("<div>Super Card<br>30 GB<span> data</span></div><div>PKR 1000</div>");

        String text = JsoupPageTextAdapter.visibleText(doc.body());

        assertThat(text.lines().map(String::trim).filter(l -> !l.isEmpty()).toList())
                .containsExactly("Super Card", "30 GB data", "PKR 1000");
    }
}
