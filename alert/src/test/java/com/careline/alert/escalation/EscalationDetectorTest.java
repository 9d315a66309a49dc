package com.careline.alert.escalation;

import com.careline.alert.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationDetectorTest {

    private static final Instant NOW = Instant.parse("2025-08-10T15:00:00Z");

    private final EscalationDetector detector = new EscalationDetector(EscalationConfig.defaults());

    private static CheckInRecord checkIn(Duration ago, int pain, MoodBucket mood) {
        return CheckInRecord.builder()
            .checkInId(UUID.randomUUID().toString())
            .subjectId("s-001")
            .createdAt(NOW.minus(ago))
            .painLevel(pain)
            .moodBucket(mood)
            .build();
    }

    /** Newest-first, as the history source returns it. */
    private static List<CheckInRecord> newestFirst(CheckInRecord... chronological) {
        List<CheckInRecord> records = new ArrayList<>(List.of(chronological));
        Collections.reverse(records);
        return records;
    }

    @Test
    @DisplayName("Pain at the threshold is high pain")
    void testHighPainAtThreshold() {
        CheckInRecord latest = checkIn(Duration.ZERO, 8, MoodBucket.GOOD);

        Optional<EscalationDetection> detection = detector.evaluate(latest, List.of(latest), NOW);

        assertThat(detection).hasValueSatisfying(d -> {
            assertThat(d.getReason()).isEqualTo(EscalationReasonKind.HIGH_PAIN);
            assertThat(d.getPainLevel()).isEqualTo(8);
        });
    }

    @Test
    @DisplayName("High pain takes precedence over low mood")
    void testHighPainBeatsLowMood() {
        CheckInRecord latest = checkIn(Duration.ZERO, 9, MoodBucket.SAD);

        assertThat(detector.detect(latest, List.of(), NOW)).contains(EscalationReasonKind.HIGH_PAIN);
    }

    @Test
    @DisplayName("Sad mood on the latest check-in is low mood")
    void testLowMood() {
        CheckInRecord latest = checkIn(Duration.ZERO, 2, MoodBucket.SAD);

        assertThat(detector.evaluate(latest, List.of(latest), NOW)).hasValueSatisfying(d -> {
            assertThat(d.getReason()).isEqualTo(EscalationReasonKind.LOW_MOOD);
            assertThat(d.getMood()).isEqualTo(MoodBucket.SAD);
        });
    }

    @Test
    @DisplayName("Mood threshold compares by rank")
    void testMoodThresholdByRank() {
        EscalationDetector neutralThreshold = new EscalationDetector(
            EscalationConfig.builder().moodEscalationThreshold(MoodBucket.NEUTRAL).build());

        assertThat(neutralThreshold.detect(checkIn(Duration.ZERO, 1, MoodBucket.NEUTRAL), List.of(), NOW))
            .contains(EscalationReasonKind.LOW_MOOD);
        assertThat(neutralThreshold.detect(checkIn(Duration.ZERO, 1, MoodBucket.GOOD), List.of(), NOW))
            .isEmpty();
    }

    @Test
    @DisplayName("Pain rising 2, 4, 7 over three days is a rapid increase")
    void testRapidPainIncrease() {
        CheckInRecord first = checkIn(Duration.ofDays(2), 2, MoodBucket.NEUTRAL);
        CheckInRecord second = checkIn(Duration.ofDays(1), 4, MoodBucket.NEUTRAL);
        CheckInRecord latest = checkIn(Duration.ZERO, 7, MoodBucket.NEUTRAL);

        Optional<EscalationDetection> detection =
            detector.evaluate(latest, newestFirst(first, second, latest), NOW);

        assertThat(detection).hasValueSatisfying(d -> {
            assertThat(d.getReason()).isEqualTo(EscalationReasonKind.RAPID_PAIN_INCREASE);
            assertThat(d.getStartPain()).isEqualTo(2);
            assertThat(d.getEndPain()).isEqualTo(7);
        });
    }

    @Test
    @DisplayName("Latest check-in missing from the window is still counted once")
    void testLatestMergedIntoWindow() {
        CheckInRecord first = checkIn(Duration.ofDays(2), 2, MoodBucket.NEUTRAL);
        CheckInRecord second = checkIn(Duration.ofDays(1), 4, MoodBucket.NEUTRAL);
        CheckInRecord latest = checkIn(Duration.ZERO, 7, MoodBucket.NEUTRAL);

        assertThat(detector.detect(latest, newestFirst(first, second), NOW))
            .contains(EscalationReasonKind.RAPID_PAIN_INCREASE);
    }

    @Test
    @DisplayName("Latest check-in already in the window is not double counted")
    void testLatestNotDoubleCounted() {
        CheckInRecord first = checkIn(Duration.ofDays(1), 3, MoodBucket.NEUTRAL);
        CheckInRecord latest = checkIn(Duration.ZERO, 7, MoodBucket.NEUTRAL);

        // Two distinct samples are below the minimum of three
        assertThat(detector.detect(latest, newestFirst(first, latest), NOW)).isEmpty();
    }

    @ParameterizedTest(name = "pains {0},{1},{2} -> rapid={3}")
    @CsvSource({
        "2, 4, 7, true",
        "3, 4, 6, true",
        "2, 3, 4, false",
        "4, 5, 6, false",
        "5, 5, 7, false"
    })
    @DisplayName("Rapid increase needs both the delta and the floor")
    void testRapidPainDeltaAndFloor(int p1, int p2, int p3, boolean expected) {
        CheckInRecord a = checkIn(Duration.ofHours(50), p1, null);
        CheckInRecord b = checkIn(Duration.ofHours(20), p2, null);
        CheckInRecord latest = checkIn(Duration.ZERO, p3, null);

        assertThat(detector.detect(latest, newestFirst(a, b, latest), NOW).isPresent()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Check-ins older than the pain lookback are ignored")
    void testRapidPainLookback() {
        CheckInRecord old = checkIn(Duration.ofDays(4), 1, null);
        CheckInRecord second = checkIn(Duration.ofDays(1), 5, null);
        CheckInRecord latest = checkIn(Duration.ZERO, 7, null);

        assertThat(detector.detect(latest, newestFirst(old, second, latest), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Two consecutive sad samples are a rapid mood drop")
    void testConsecutiveSadMood() {
        CheckInRecord earlier = checkIn(Duration.ofDays(1), 1, MoodBucket.SAD);
        CheckInRecord latest = checkIn(Duration.ZERO, 1, MoodBucket.SAD);

        assertThat(detector.detectRapidMoodDrop(newestFirst(earlier, latest), NOW))
            .hasValueSatisfying(d -> {
                assertThat(d.getReason()).isEqualTo(EscalationReasonKind.RAPID_MOOD_DROP);
                assertThat(d.getPreviousMood()).isEqualTo(MoodBucket.SAD);
            });
        // On the full rule set the sad latest check-in is reported as low mood first
        assertThat(detector.detect(latest, newestFirst(earlier, latest), NOW))
            .contains(EscalationReasonKind.LOW_MOOD);
    }

    @Test
    @DisplayName("Sad run length of zero is met by any sad latest mood, a longer run needs enough samples")
    void testConsecutiveSadRunLength() {
        CheckInRecord earlier = checkIn(Duration.ofDays(1), 1, MoodBucket.SAD);
        CheckInRecord latest = checkIn(Duration.ZERO, 1, MoodBucket.SAD);
        List<CheckInRecord> history = newestFirst(earlier, latest);

        EscalationDetector zeroRun = new EscalationDetector(
            EscalationConfig.builder().consecutiveSadMoodCount(0).build());
        EscalationDetector longRun = new EscalationDetector(
            EscalationConfig.builder().consecutiveSadMoodCount(3).build());

        assertThat(zeroRun.detectRapidMoodDrop(history, NOW))
            .hasValueSatisfying(d -> assertThat(d.getReason()).isEqualTo(EscalationReasonKind.RAPID_MOOD_DROP));
        assertThat(longRun.detectRapidMoodDrop(history, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Drop from a better mood to sad is a rapid mood drop")
    void testMoodDropFromGood() {
        CheckInRecord earlier = checkIn(Duration.ofDays(2), 1, MoodBucket.GOOD);
        CheckInRecord latestSad = checkIn(Duration.ofHours(3), 1, MoodBucket.SAD);

        assertThat(detector.detectRapidMoodDrop(newestFirst(earlier, latestSad), NOW))
            .hasValueSatisfying(d -> assertThat(d.getPreviousMood()).isEqualTo(MoodBucket.GOOD));
    }

    @Test
    @DisplayName("Sad mood reported from history with a neutral latest check-in fires the trend rule")
    void testMoodDropThroughDetect() {
        CheckInRecord good = checkIn(Duration.ofDays(2), 1, MoodBucket.GOOD);
        CheckInRecord sad = checkIn(Duration.ofDays(1), 1, MoodBucket.SAD);
        // Latest check-in carries no mood, so the sad sample from yesterday is the most recent mood
        CheckInRecord latest = checkIn(Duration.ZERO, 1, null);

        assertThat(detector.detect(latest, newestFirst(good, sad, latest), NOW))
            .contains(EscalationReasonKind.RAPID_MOOD_DROP);
    }

    @Test
    @DisplayName("A single mood sample never counts as a drop")
    void testSingleMoodSample() {
        CheckInRecord sad = checkIn(Duration.ofHours(1), 1, MoodBucket.SAD);

        assertThat(detector.detectRapidMoodDrop(List.of(sad), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Improving mood does not fire")
    void testImprovingMood() {
        CheckInRecord sad = checkIn(Duration.ofDays(1), 1, MoodBucket.SAD);
        CheckInRecord neutral = checkIn(Duration.ZERO, 1, MoodBucket.NEUTRAL);

        assertThat(detector.detect(neutral, newestFirst(sad, neutral), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Mood samples outside the lookback are ignored")
    void testMoodLookback() {
        CheckInRecord oldGood = checkIn(Duration.ofDays(6), 1, MoodBucket.GOOD);
        CheckInRecord sad = checkIn(Duration.ofDays(1), 1, MoodBucket.SAD);

        assertThat(detector.detectRapidMoodDrop(newestFirst(oldGood, sad), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Calm check-in with calm history yields no reason")
    void testNoEscalation() {
        CheckInRecord earlier = checkIn(Duration.ofDays(1), 3, MoodBucket.GOOD);
        CheckInRecord latest = checkIn(Duration.ZERO, 3, MoodBucket.NEUTRAL);

        assertThat(detector.evaluate(latest, newestFirst(earlier, latest), NOW)).isEmpty();
    }
}
