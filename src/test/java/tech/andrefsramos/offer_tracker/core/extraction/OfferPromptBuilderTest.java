package tech.andrefsramos.offer_tracker.core.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OfferPromptBuilderTest {

    @Test
    void truncatesPageText() {
        OfferPromptBuilder builder = new OfferPromptBuilder(10);

        String prompt = builder.build("Zong", "0123456789ABCDEF");

        assertThat(prompt).contains("0123456789").doesNotContain("ABCDEF");
        assertThat(prompt).contains("Operator: Zong");
    }
}
