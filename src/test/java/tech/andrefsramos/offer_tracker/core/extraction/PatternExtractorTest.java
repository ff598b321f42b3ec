package tech.andrefsramos.offer_tracker.core.extraction;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.domain.RawBlock;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cobre as regras de extração por padrões sobre cards já recortados.
 */
class PatternExtractorTest {

    private final PatternExtractor extractor = new PatternExtractor();

    @Test
    void extractsAllFieldsFromTypicalCard() {
        RawBlock card = RawBlock.of("Weekly Super Card", "10GB Data", "500 Mins", "Rs. 250 Incl. Tax");

        ExtractedOffer offer = extractor.extract("Jazz", card);

        assertThat(offer.operator()).isEqualTo("Jazz");
        assertThat(offer.name()).isEqualTo("Weekly Super Card");
        assertThat(offer.validity()).isEqualTo("Weekly");
        assertThat(offer.details()).isEqualTo("10GB Data, 500 Mins");
        assertThat(offer.price()).isEqualTo("250");
    }

    @Test
    void missingPriceAndDetailsUseConservativeDefaults() {
        ExtractedOffer offer = extractor.extract("Zong", RawBlock.of("Super Pack", "Free WhatsApp"));

        assertThat(offer.name()).isEqualTo("Super Pack");
        assertThat(offer.price()).isEqualTo("N/A");
        assertThat(offer.validity()).isEqualTo("N/A");
        assertThat(offer.details()).isEqualTo("Check Site");
    }

    @Test
    void lastValidityKeywordWins() {
        RawBlock card = RawBlock.of("Daily Saver", "1GB Data", "Valid for 3 days", "Rs. 50");

        ExtractedOffer offer = extractor.extract("Zong", card);

        assertThat(offer.name()).isEqualTo("Daily Saver");
        assertThat(offer.validity()).isEqualTo("3 Days");
    }

    @Test
    void priceLinesNeverFeedOtherFields() {
        RawBlock card = RawBlock.of("Rs. 100 10GB Weekly", "Super Pack", "Rs. 200 Monthly");

        ExtractedOffer offer = extractor.extract("Zong", card);

        assertThat(offer.price()).isEqualTo("100");
        assertThat(offer.details()).isEqualTo("Check Site");
        assertThat(offer.validity()).isEqualTo("N/A");
        assertThat(offer.name()).isEqualTo("Super Pack");
    }

    @Test
    void consumerPriceMarkerWithThousandsSeparator() {
        RawBlock card = RawBlock.of("Monthly Mega", "PKR. 1,500.00 Consumer Price", "30 GB", "3000 SMS");

        ExtractedOffer offer = extractor.extract("Zong", card);

        assertThat(offer.price()).isEqualTo("1,500.00");
        assertThat(offer.details()).isEqualTo("30 GB, 3000 SMS");
        assertThat(offer.validity()).isEqualTo("Monthly");
    }

    @Test
    void lineMatchingSeveralDetailRulesIsAddedOnce() {
        ExtractedOffer offer = extractor.extract("Zong", RawBlock.of("Super Card", "5GB + 300 Mins + 300 SMS", "Rs. 100"));

        assertThat(offer.details()).isEqualTo("5GB + 300 Mins + 300 SMS");
        assertThat(offer.name()).isEqualTo("Super Card");
    }

    @Test
    void proseEndingInRsIsStillANameCandidate() {
        ExtractedOffer offer = extractor.extract("Jazz", RawBlock.of("Best offers.", "2GB", "Rs. 30"));

        assertThat(offer.name()).isEqualTo("Best offers.");
        assertThat(offer.price()).isEqualTo("30");
    }

    @Test
    void detailLineIsNeverTheName() {
        ExtractedOffer offer = extractor.extract("Jazz", RawBlock.of("25GB Data", "Smart Bundle", "Rs. 600"));

        assertThat(offer.name()).isEqualTo("Smart Bundle");
        assertThat(offer.details()).isEqualTo("25GB Data");
    }

    @Test
    void shortOrBlockedLinesAreNotNames() {
        ExtractedOffer offer = extractor.extract("Jazz", RawBlock.of("SUBSCRIBE", "Rs. 10", "abc"));

        assertThat(offer.name()).isEqualTo(ExtractedOffer.UNKNOWN_NAME);
        assertThat(offer.isUnknown()).isTrue();
    }

    @Test
    void extractionIsDeterministic() {
        RawBlock card = RawBlock.of("Weekly Super Card", "10GB Data", "500 Mins", "Rs. 250 Incl. Tax");

        assertThat(extractor.extract("Jazz", card)).isEqualTo(extractor.extract("Jazz", card));
    }

    @Test
    void pageExtractionDropsUnnamedBlocks() {
        PageContent page = new PageContent("Jazz", "https://example.test", "", List.of(
                RawBlock.of("Weekly Super Card", "10GB Data", "Rs. 250"),
                RawBlock.of("SUBSCRIBE", "Rs. 10"),
                RawBlock.of("Monthly Hybrid", "5000 Mins", "Rs. 1,200")
        ));

        List<ExtractedOffer> offers = extractor.extract("Jazz", page);

        assertThat(offers).extracting(ExtractedOffer::name)
                .containsExactly("Weekly Super Card", "Monthly Hybrid");
    }

    @Test
    void pageWithoutBlocksYieldsNothing() {
        assertThat(extractor.extract("Jazz", PageContent.fromText("Jazz", "   "))).isEmpty();
        assertThat(extractor.extract("Jazz", (PageContent) null)).isEmpty();
    }
}
