package tech.andrefsramos.offer_tracker.core.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerSnapshotTest {

    @Test
    void lastAppendedRowWinsRegardlessOfDate() {
        HistoricalRecord newerDateFirst = new HistoricalRecord(LocalDate.of(2024, 6, 2), "Zong", "Super Card", "Monthly", "x", "1000");
        HistoricalRecord olderDateLast = new HistoricalRecord(LocalDate.of(2024, 6, 1), "Zong", "Super Card", "Monthly", "x", "1200");

        LedgerSnapshot snapshot = LedgerSnapshot.of(List.of(newerDateFirst, olderDateLast));

        assertThat(snapshot.find("Zong", "Super Card")).contains(olderDateLast);
        assertThat(snapshot.size()).isEqualTo(1);
    }

    @Test
    void keyIsExactOperatorAndName() {
        HistoricalRecord r = new HistoricalRecord(LocalDate.of(2024, 6, 1), "Zong", "Super Card", "Monthly", "x", "1000");
        LedgerSnapshot snapshot = LedgerSnapshot.of(List.of(r));

        assertThat(snapshot.find("zong", "Super Card")).isEmpty();
        assertThat(snapshot.find("Zong", "super card")).isEmpty();
        assertThat(snapshot.find("Jazz", "Super Card")).isEmpty();
    }

    @Test
    void emptyOrNullHistoryFindsNothing() {
        assertThat(LedgerSnapshot.of(null).find("Zong", "Super Card")).isEmpty();
        assertThat(LedgerSnapshot.of(List.of()).size()).isZero();
    }
}
