package tech.andrefsramos.offer_tracker.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelPreferenceTest {

    private final ModelPreference preference = new ModelPreference(List.of("flash", "pro"), "gemini-1.5-flash");

    @Test
    void firstPreferenceThatMatchesWins() {
        String model = preference.resolve(List.of("gemini-1.0-pro", "gemini-2.0-flash", "gemini-1.5-flash"));

        assertThat(model).isEqualTo("gemini-2.0-flash");
    }

    @Test
    void laterPreferenceUsedWhenEarlierAbsent() {
        assertThat(preference.resolve(List.of("text-embedding-004", "gemini-1.5-PRO"))).isEqualTo("gemini-1.5-PRO");
    }

    @Test
    void noMatchFallsBackToFirstAvailable() {
        assertThat(preference.resolve(List.of("gemma-7b", "ultra-1"))).isEqualTo("gemma-7b");
    }

    @Test
    void emptyListingUsesConfiguredDefault() {
        assertThat(preference.resolve(List.of())).isEqualTo("gemini-1.5-flash");
        assertThat(preference.resolve(null)).isEqualTo("gemini-1.5-flash");
    }

    @Test
    void blankFragmentsAreIgnored() {
        ModelPreference p = new ModelPreference(List.of(" ", "Pro "), "x");

        assertThat(p.fragments()).containsExactly("pro");
    }
}
