package tech.andrefsramos.offer_tracker.core.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.PageContent;
import tech.andrefsramos.offer_tracker.core.domain.RetryPolicy;
import tech.andrefsramos.offer_tracker.core.ports.InferenceClientPort;
import tech.andrefsramos.offer_tracker.core.ports.InferenceException;
import tech.andrefsramos.offer_tracker.core.ports.RateLimitedException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Retentativa com espera fixa e falhas terminais da estratégia de inferência.
 * O cliente e o sleeper são falsos: nenhum teste espera de verdade.
 */
class InferenceExtractorTest {

    private static final String PAGE_TEXT = "Weekly Super Card 10GB Data 500 Mins Rs. 250 Incl. Tax SUBSCRIBE";
    private static final String OK = "[{\"name\":\"Weekly Super Card\",\"price\":\"250\",\"validity\":\"Weekly\",\"details\":\"10GB Data, 500 Mins\"}]";
    private static final Duration DELAY = Duration.ofSeconds(60);

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private static final class ScriptedClient implements InferenceClientPort {
        private final Deque<Supplier<String>> script = new ArrayDeque<>();
        private final List<String> prompts = new ArrayList<>();

        ScriptedClient then(Supplier<String> step) {
            script.add(step);
            return this;
        }

        @Override
        public String generate(String prompt) {
            prompts.add(prompt);
            Supplier<String> step = script.poll();
            if (step == null) throw new IllegalStateException("unexpected call");
            return step.get();
        }
    }

    private static Supplier<String> rateLimited() {
        return () -> { throw new RateLimitedException("429"); };
    }

    private InferenceExtractor extractor(InferenceClientPort client, Sleeper sleeper) {
        return new InferenceExtractor(client, new OfferPromptBuilder(30_000),
                new InferenceResponseParser(new ObjectMapper()), RetryPolicy.fixed(3, DELAY), sleeper, 20);
    }

    @Test
    void rateLimitedTwiceThenSucceeds() {
        ScriptedClient client = new ScriptedClient().then(rateLimited()).then(rateLimited()).then(() -> OK);

        List<ExtractedOffer> offers = extractor(client, recordingSleeper).extract("Jazz", PAGE_TEXT);

        assertThat(offers).hasSize(1);
        assertThat(offers.get(0).price()).isEqualTo("250");
        assertThat(client.prompts).hasSize(3);
        assertThat(client.prompts).allMatch(p -> p.equals(client.prompts.get(0)));
        assertThat(sleeps).containsExactly(DELAY, DELAY);
    }

    @Test
    void givesUpAfterMaxAttemptsWithoutFinalSleep() {
        ScriptedClient client = new ScriptedClient().then(rateLimited()).then(rateLimited()).then(rateLimited());

        List<ExtractedOffer> offers = extractor(client, recordingSleeper).extract("Jazz", PAGE_TEXT);

        assertThat(offers).isEmpty();
        assertThat(client.prompts).hasSize(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void shortTextSkipsTheCall() {
        ScriptedClient client = new ScriptedClient();

        List<ExtractedOffer> offers = extractor(client, recordingSleeper).extract("Zong", "Loading...");

        assertThat(offers).isEmpty();
        assertThat(client.prompts).isEmpty();
    }

    @Test
    void malformedPayloadIsTerminal() {
        ScriptedClient client = new ScriptedClient().then(() -> "Sorry, I cannot help with that.");

        List<ExtractedOffer> offers = extractor(client, recordingSleeper).extract("Zong", PAGE_TEXT);

        assertThat(offers).isEmpty();
        assertThat(client.prompts).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void serviceErrorIsTerminal() {
        ScriptedClient client = new ScriptedClient().then(() -> { throw new InferenceException("HTTP 500"); });

        assertThat(extractor(client, recordingSleeper).extract("Zong", PAGE_TEXT)).isEmpty();
        assertThat(client.prompts).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedWaitReturnsEmptyAndKeepsFlag() {
        ScriptedClient client = new ScriptedClient().then(rateLimited()).then(() -> OK);
        Sleeper interrupting = d -> { throw new InterruptedException(); };

        try {
            assertThat(extractor(client, interrupting).extract("Zong", PAGE_TEXT)).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(client.prompts).hasSize(1);
    }

    @Test
    void pageVariantUsesFullText() {
        ScriptedClient client = new ScriptedClient().then(() -> OK);

        List<ExtractedOffer> offers = extractor(client, recordingSleeper)
                .extract("Jazz", PageContent.fromText("Jazz", PAGE_TEXT));

        assertThat(offers).extracting(ExtractedOffer::operator).containsExactly("Jazz");
        assertThat(client.prompts.get(0)).contains("Operator: Jazz").contains("Rs. 250 Incl. Tax");
    }
}
