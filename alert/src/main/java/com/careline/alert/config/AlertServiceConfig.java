package com.careline.alert.config;

import com.careline.alert.model.EscalationConfig;
import com.careline.alert.model.MoodBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AlertServiceConfig {

    private static final Logger logger = LoggerFactory.getLogger(AlertServiceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EscalationConfig escalationConfig(
            @Value("${escalation.high-pain-threshold:8}") int highPainThreshold,
            @Value("${escalation.mood-escalation-threshold:sad}") String moodEscalationThreshold,
            @Value("${escalation.rapid-pain-lookback-days:3}") int rapidPainLookbackDays,
            @Value("${escalation.rapid-pain-increase:3}") int rapidPainIncrease,
            @Value("${escalation.rapid-pain-floor:6}") int rapidPainFloor,
            @Value("${escalation.rapid-mood-lookback-days:5}") int rapidMoodLookbackDays,
            @Value("${escalation.min-trend-samples:3}") int minTrendSamples,
            @Value("${escalation.notification-cooldown-hours:12}") int notificationCooldownHours,
            @Value("${escalation.consecutive-sad-mood-count:2}") int consecutiveSadMoodCount,
            @Value("${escalation.max-history-samples:15}") int maxHistorySamples) {
        MoodBucket moodThreshold = MoodBucket.fromText(moodEscalationThreshold);
        if (moodThreshold == null) {
            throw new IllegalStateException("Unknown escalation.mood-escalation-threshold: " + moodEscalationThreshold);
        }
        if (consecutiveSadMoodCount < 0) {
            throw new IllegalStateException(
                "escalation.consecutive-sad-mood-count must not be negative: " + consecutiveSadMoodCount);
        }

        EscalationConfig config = EscalationConfig.builder()
            .highPainThreshold(highPainThreshold)
            .moodEscalationThreshold(moodThreshold)
            .rapidPainLookbackDays(rapidPainLookbackDays)
            .rapidPainIncrease(rapidPainIncrease)
            .rapidPainFloor(rapidPainFloor)
            .rapidMoodLookbackDays(rapidMoodLookbackDays)
            .minTrendSamples(minTrendSamples)
            .notificationCooldownHours(notificationCooldownHours)
            .consecutiveSadMoodCount(consecutiveSadMoodCount)
            .maxHistorySamples(maxHistorySamples)
            .build();
        logger.info("Escalation rules loaded: {}", config);
        return config;
    }
}
