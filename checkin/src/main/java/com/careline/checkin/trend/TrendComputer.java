package com.careline.checkin.trend;

import com.careline.checkin.history.HistorySource;
import com.careline.checkin.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Builds per-subject trend datasets from check-in history.
 *
 * <p>Read-only: it only queries the {@link HistorySource}, so any number of
 * computations may run at once. A failed history query surfaces as the
 * source's error and never as a partial result.
 */
@Component
public class TrendComputer {

    private static final Logger logger = LoggerFactory.getLogger(TrendComputer.class);

    private static final Comparator<CheckInRecord> CHRONOLOGICAL =
        Comparator.comparing(CheckInRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final HistorySource historySource;
    private final TextCategorizer symptomCategorizer;
    private final TextCategorizer concernCategorizer;
    private final Clock clock;

    @Value("${trends.top-categories:5}")
    private int topCategoryLimit = 5;

    public TrendComputer(HistorySource historySource,
                         @Qualifier("symptomCategorizer") TextCategorizer symptomCategorizer,
                         @Qualifier("concernCategorizer") TextCategorizer concernCategorizer,
                         Clock clock) {
        this.historySource = historySource;
        this.symptomCategorizer = symptomCategorizer;
        this.concernCategorizer = concernCategorizer;
        this.clock = clock;
    }

    /**
     * Computes trends for the window ending now.
     *
     * @param windowDays lookback in days; values below 1 are raised to 1
     * @param maxRecords cap on records fetched, newest first
     * @param zone       calendar used for day buckets and dayparts
     */
    public Mono<TrendResult> computeTrends(String subjectId, int windowDays, int maxRecords, ZoneId zone) {
        Instant windowEnd = clock.instant();
        Instant windowStart = windowEnd.minus(Duration.ofDays(Math.max(1, windowDays)));

        CheckInHistoryFilter filter = CheckInHistoryFilter.builder()
            .startDate(windowStart)
            .endDate(windowEnd)
            .limit(maxRecords)
            .build();

        return historySource.fetchHistory(subjectId, filter)
            .map(records -> summarize(records, windowStart, windowEnd, zone))
            .doOnSuccess(result -> logger.info("Computed trends for subject {}: {} records over {} days",
                subjectId, result.getTotalRecordsInWindow(), Math.max(1, windowDays)))
            .doOnError(error -> logger.error("Trend computation failed for subject {}: {}",
                subjectId, error.getMessage()));
    }

    TrendResult summarize(List<CheckInRecord> fetched, Instant windowStart, Instant windowEnd, ZoneId zone) {
        List<CheckInRecord> chronological = new ArrayList<>(fetched);
        chronological.sort(CHRONOLOGICAL);

        List<PainPoint> painSeries = new ArrayList<>(chronological.size());
        Map<EnergyBucket, Integer> energy = new EnumMap<>(EnergyBucket.class);
        Map<MoodBucket, Integer> mood = new EnumMap<>(MoodBucket.class);
        Map<Daypart, Integer> dayparts = new EnumMap<>(Daypart.class);

        // Insertion order doubles as first-seen order for ranking ties.
        Map<String, Integer> symptomTotals = new LinkedHashMap<>();
        Map<String, TreeMap<LocalDate, Integer>> symptomByDay = new HashMap<>();
        Map<String, Integer> concernTotals = new LinkedHashMap<>();

        for (CheckInRecord record : chronological) {
            Instant createdAt = record.getCreatedAt();
            if (createdAt != null) {
                painSeries.add(new PainPoint(createdAt, record.getPainLevel() == null ? 0 : record.getPainLevel()));
                dayparts.merge(Daypart.from(createdAt, zone), 1, Integer::sum);
            }
            if (record.getEnergyBucket() != null) {
                energy.merge(record.getEnergyBucket(), 1, Integer::sum);
            }
            if (record.getMoodBucket() != null) {
                mood.merge(record.getMoodBucket(), 1, Integer::sum);
            }

            for (String category : concernCategorizer.categorize(record.getConcerns())) {
                concernTotals.merge(category, 1, Integer::sum);
            }

            List<String> categories = symptomCategorizer.categorize(record.getSymptoms());
            if (categories.isEmpty()) {
                continue;
            }
            LocalDate day = (createdAt == null ? windowEnd : createdAt).atZone(zone).toLocalDate();
            for (String category : categories) {
                symptomTotals.merge(category, 1, Integer::sum);
                symptomByDay.computeIfAbsent(category, key -> new TreeMap<>()).merge(day, 1, Integer::sum);
            }
        }

        List<CategoryCount> rankedSymptoms = rank(symptomTotals);
        Map<String, List<DailyCount>> daily = new LinkedHashMap<>();
        rankedSymptoms.stream()
            .limit(topCategoryLimit)
            .forEach(top -> {
                List<DailyCount> series = new ArrayList<>();
                symptomByDay.get(top.getCategory())
                    .forEach((day, count) -> series.add(new DailyCount(day, count)));
                daily.put(top.getCategory(), series);
            });

        return TrendResult.builder()
            .painSeries(painSeries)
            .energyDistribution(energy)
            .moodDistribution(mood)
            .daypartDistribution(dayparts)
            .symptomCategoryTotals(rankedSymptoms)
            .symptomCategoryDaily(daily)
            .concernCategoryTotals(rank(concernTotals))
            .totalRecordsInWindow(fetched.size())
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .zone(zone)
            .build();
    }

    // Stable sort keeps first-seen order among equal counts.
    private static List<CategoryCount> rank(Map<String, Integer> totals) {
        List<CategoryCount> ranked = new ArrayList<>();
        totals.forEach((category, count) -> ranked.add(new CategoryCount(category, count)));
        ranked.sort(Comparator.comparingInt(CategoryCount::getCount).reversed());
        return ranked;
    }
}
