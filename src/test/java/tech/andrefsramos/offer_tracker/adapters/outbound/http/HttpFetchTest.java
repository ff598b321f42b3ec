package tech.andrefsramos.offer_tracker.adapters.outbound.http;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFetchTest {

    @Test
    void browserFirstThenBotThenAlternating() {
        assertThat(HttpFetch.attemptPlan(3)).containsExactly(
                HttpFetch.UA_BROWSER, HttpFetch.UA_BOT,
                HttpFetch.UA_BROWSER, HttpFetch.UA_BOT, HttpFetch.UA_BROWSER);
    }

    @Test
    void negativeRetriesKeepBothAgents() {
        assertThat(HttpFetch.attemptPlan(-1)).containsExactly(HttpFetch.UA_BROWSER, HttpFetch.UA_BOT);
    }

    @Test
    void unreachableHostGivesNull() {
        assertThat(HttpFetch.get("http://127.0.0.1:1/prepaid", 300, 0, 0)).isNull();
    }
}
