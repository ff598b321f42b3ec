package tech.andrefsramos.offer_tracker.core.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RawBlockTest {

    @Test
    void linesAreTrimmedAndBlankLinesDropped() {
        RawBlock block = RawBlock.of("  Weekly Super Card \n\n\t10GB Data\r\n   \nRs. 250");

        assertThat(block.lines()).containsExactly("Weekly Super Card", "10GB Data", "Rs. 250");
    }

    @Test
    void pageTextIsSplitIntoParagraphBlocks() {
        PageContent page = PageContent.fromText("Jazz", "Weekly Card\nRs. 100\n\n  \nMonthly Card\nRs. 900\n");

        assertThat(page.blocks()).hasSize(2);
        assertThat(page.blocks().get(1).lines()).containsExactly("Monthly Card", "Rs. 900");
        assertThat(page.fullText()).contains("Weekly Card");
    }
}
