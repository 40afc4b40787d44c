package com.pos.anomaly.engine;

import com.pos.anomaly.model.CohortKey;
import com.pos.anomaly.model.TimeSlot;
import com.pos.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CohortClassifierTest {

    // 2025-06-02 is a Monday
    private static final LocalDate MONDAY = LocalDate.of(2025, 6, 2);

    private CohortClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new CohortClassifier(TestDataFactory.defaultConfig());
    }

    @Test
    void classify_morningOpening_isAmSlot() {
        Optional<CohortKey> cohort = classifier.classify(TestDataFactory.localTime(MONDAY, 8, 15));

        assertThat(cohort).contains(new CohortKey("Mon", TimeSlot.AM));
        assertThat(cohort.get().getLabel()).isEqualTo("Mon-AM");
    }

    @Test
    void classify_eveningOpening_isPmSlot() {
        Optional<CohortKey> cohort = classifier.classify(TestDataFactory.localTime(MONDAY, 17, 0));

        assertThat(cohort).contains(new CohortKey("Mon", TimeSlot.PM));
    }

    @Test
    void classify_slotBoundaries_areInclusive() {
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY, 4, 0)))
                .map(CohortKey::getTimeSlot).contains(TimeSlot.AM);
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY, 11, 59)))
                .map(CohortKey::getTimeSlot).contains(TimeSlot.AM);
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY, 16, 0)))
                .map(CohortKey::getTimeSlot).contains(TimeSlot.PM);
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY, 23, 59)))
                .map(CohortKey::getTimeSlot).contains(TimeSlot.PM);
    }

    @Test
    void classify_hoursOutsideSlots_haveNoCohort() {
        for (int hour : new int[]{0, 1, 2, 3, 12, 13, 14, 15}) {
            assertThat(classifier.classify(TestDataFactory.localTime(MONDAY, hour, 30)))
                    .as("hour %d", hour)
                    .isEmpty();
        }
    }

    @Test
    void classify_usesStoreLocalTime() {
        // 2025-06-01T22:30Z is Monday 06:30 in UTC+8, while still Sunday in UTC
        Instant openedAt = Instant.parse("2025-06-01T22:30:00Z");

        assertThat(classifier.classify(openedAt)).contains(new CohortKey("Mon", TimeSlot.AM));
    }

    @Test
    void classify_dayNamesAreEnglishShortNames() {
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY.plusDays(5), 9, 0)))
                .map(CohortKey::getDayName).contains("Sat");
        assertThat(classifier.classify(TestDataFactory.localTime(MONDAY.plusDays(6), 9, 0)))
                .map(CohortKey::getDayName).contains("Sun");
    }

    @Test
    void classify_nullOpening_hasNoCohort() {
        assertThat(classifier.classify(null)).isEmpty();
    }
}
