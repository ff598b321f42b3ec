package tech.andrefsramos.offer_tracker.core.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OfferChangePolicyTest {

    private final OfferChangePolicy policy = new OfferChangePolicy();

    private static ExtractedOffer offer(String price, String details) {
        return new ExtractedOffer("Jazz", "Weekly Super Card", price, "Weekly", details);
    }

    private static HistoryLookup history(String price, String details) {
        HistoricalRecord r = new HistoricalRecord(LocalDate.of(2024, 5, 1), "Jazz", "Weekly Super Card",
                "Weekly", details, price);
        return LedgerSnapshot.of(List.of(r));
    }

    @Test
    void noHistoryIsNewOffer() {
        ChangeResult r = policy.compare(offer("250", "10GB Data"), HistoryLookup.empty());

        assertThat(r.category()).isEqualTo(ChangeCategory.NEW);
        assertThat(r.remark()).isEqualTo("New Offer");
        assertThat(r.isNew()).isTrue();
    }

    @Test
    void identicalPriceAndDetailsIsSame() {
        ChangeResult r = policy.compare(offer("250", "10GB Data, 500 Mins"), history("250", "10GB Data, 500 Mins"));

        assertThat(r.category()).isEqualTo(ChangeCategory.SAME);
        assertThat(r.remark()).isEqualTo("Same");
    }

    @Test
    void comparisonTrimsBothSides() {
        ChangeResult r = policy.compare(offer("250", "10GB Data"), history(" 250 ", "10GB Data  "));

        assertThat(r.category()).isEqualTo(ChangeCategory.SAME);
    }

    @Test
    void priceChangeDescribesOldAndNew() {
        ChangeResult r = policy.compare(offer("300", "10GB Data, 500 Mins"), history("250", "10GB Data, 500 Mins"));

        assertThat(r.remark()).isEqualTo("Changed: Price: 250->300");
        assertThat(r.priceChanged()).isTrue();
        assertThat(r.detailsChanged()).isFalse();
        assertThat(r.previousPrice()).isEqualTo("250");
    }

    @Test
    void detailsChangeIsFlagged() {
        ChangeResult r = policy.compare(offer("250", "12GB Data"), history("250", "10GB Data"));

        assertThat(r.remark()).isEqualTo("Changed: Details Updated");
        assertThat(r.detailsChanged()).isTrue();
    }

    @Test
    void bothChangesAreCommaJoined() {
        ChangeResult r = policy.compare(offer("300", "12GB Data"), history("250", "10GB Data"));

        assertThat(r.remark()).isEqualTo("Changed: Price: 250->300, Details Updated");
        assertThat(r.isChanged()).isTrue();
    }

    @Test
    void sameLabelIsConfigurable() {
        OfferChangePolicy yesterday = new OfferChangePolicy("Same as yesterday");

        ChangeResult r = yesterday.compare(offer("250", "10GB Data"), history("250", "10GB Data"));

        assertThat(r.category()).isEqualTo(ChangeCategory.SAME);
        assertThat(r.remark()).isEqualTo("Same as yesterday");
    }

    @Test
    void renamedOfferIsNotMatched() {
        ExtractedOffer renamed = new ExtractedOffer("Jazz", "Weekly Super Card Plus", "250", "Weekly", "10GB Data");

        ChangeResult r = policy.compare(renamed, history("250", "10GB Data"));

        assertThat(r.remark()).isEqualTo("New Offer");
    }

    @Test
    void nullOfferIsAContractViolation() {
        assertThrows(NullPointerException.class, () -> policy.compare(null, HistoryLookup.empty()));
        assertThrows(NullPointerException.class, () -> policy.compare(offer("1", "x"), (HistoryLookup) null));
        assertThrows(NullPointerException.class,
                () -> policy.compare(offer("1", "x"), (Optional<HistoricalRecord>) null));
    }

    @Test
    void optionalOverloadMatchesLookupOverload() {
        ChangeResult r = policy.compare(offer("250", "10GB Data"), Optional.empty());

        assertThat(r.remark()).isEqualTo(OfferChangePolicy.NEW_OFFER);
    }
}
