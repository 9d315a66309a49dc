package com.careline.alert.escalation;

import com.careline.alert.model.CheckInRecord;
import com.careline.alert.model.EscalationConfig;
import com.careline.alert.model.EscalationDetection;
import com.careline.alert.model.EscalationReasonKind;
import com.careline.alert.model.MoodBucket;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates the latest check-in and a bounded history window against the
 * escalation rules. Rules are checked in a fixed order and the first match wins:
 *
 * <ol>
 *   <li>high pain on the latest check-in</li>
 *   <li>mood at or below the escalation threshold on the latest check-in</li>
 *   <li>pain rising quickly across the recent window</li>
 *   <li>mood dropping to sad across the recent window</li>
 * </ol>
 *
 * Stateless; safe to share between concurrent evaluations.
 */
@Component
public class EscalationDetector {

    private static final Comparator<CheckInRecord> CHRONOLOGICAL = Comparator.comparing(CheckInRecord::getCreatedAt);

    private final EscalationConfig config;

    public EscalationDetector(EscalationConfig config) {
        this.config = config;
    }

    public Optional<EscalationReasonKind> detect(CheckInRecord latest, List<CheckInRecord> recentHistory, Instant now) {
        return evaluate(latest, recentHistory, now).map(EscalationDetection::getReason);
    }

    /**
     * @param recentHistory newest-first window for the same subject; may or may not contain {@code latest}
     */
    public Optional<EscalationDetection> evaluate(CheckInRecord latest, List<CheckInRecord> recentHistory, Instant now) {
        Integer pain = latest.getPainLevel();
        if (pain != null && pain >= config.getHighPainThreshold()) {
            return Optional.of(EscalationDetection.highPain(pain));
        }

        MoodBucket mood = latest.getMoodBucket();
        if (mood != null && mood.isAtOrBelow(config.getMoodEscalationThreshold())) {
            return Optional.of(EscalationDetection.lowMood(mood));
        }

        List<CheckInRecord> window = withLatest(latest, recentHistory);

        Optional<EscalationDetection> rapidPain = detectRapidPainIncrease(window, now);
        if (rapidPain.isPresent()) {
            return rapidPain;
        }
        return detectRapidMoodDrop(window, now);
    }

    Optional<EscalationDetection> detectRapidPainIncrease(List<CheckInRecord> history, Instant now) {
        Instant cutoff = now.minus(config.getRapidPainLookback());
        List<CheckInRecord> window = history.stream()
            .filter(record -> record.getCreatedAt() != null && !record.getCreatedAt().isBefore(cutoff))
            .filter(record -> record.getPainLevel() != null)
            .sorted(CHRONOLOGICAL)
            .collect(Collectors.toList());

        if (window.isEmpty() || window.size() < config.getMinTrendSamples()) {
            return Optional.empty();
        }

        int first = window.get(0).getPainLevel();
        int last = window.get(window.size() - 1).getPainLevel();
        if (last - first >= config.getRapidPainIncrease() && last >= config.getRapidPainFloor()) {
            return Optional.of(EscalationDetection.rapidPainIncrease(first, last));
        }
        return Optional.empty();
    }

    Optional<EscalationDetection> detectRapidMoodDrop(List<CheckInRecord> history, Instant now) {
        Instant cutoff = now.minus(config.getRapidMoodLookback());
        List<MoodBucket> moods = history.stream()
            .filter(record -> record.getCreatedAt() != null && !record.getCreatedAt().isBefore(cutoff))
            .filter(record -> record.getMoodBucket() != null)
            .sorted(CHRONOLOGICAL)
            .map(CheckInRecord::getMoodBucket)
            .collect(Collectors.toList());

        if (moods.size() < 2) {
            return Optional.empty();
        }

        MoodBucket latestMood = moods.get(moods.size() - 1);
        if (latestMood != MoodBucket.SAD) {
            return Optional.empty();
        }
        MoodBucket previous = moods.get(moods.size() - 2);

        // A run length of 0 is met by any sad latest mood
        int run = config.getConsecutiveSadMoodCount();
        if (moods.size() >= run
            && moods.subList(moods.size() - run, moods.size()).stream().allMatch(m -> m == MoodBucket.SAD)) {
            return Optional.of(EscalationDetection.rapidMoodDrop(previous));
        }
        if (latestMood.isWorseThan(previous)) {
            return Optional.of(EscalationDetection.rapidMoodDrop(previous));
        }
        return Optional.empty();
    }

    // The caller's window may have been fetched before the latest check-in was stored.
    private static List<CheckInRecord> withLatest(CheckInRecord latest, List<CheckInRecord> recentHistory) {
        List<CheckInRecord> window = new ArrayList<>(recentHistory == null ? List.of() : recentHistory);
        boolean present = latest.getCheckInId() != null && window.stream()
            .anyMatch(record -> Objects.equals(record.getCheckInId(), latest.getCheckInId()));
        if (!present) {
            window.add(0, latest);
        }
        return window;
    }
}
