package com.careline.checkin.guidance;

import com.careline.checkin.history.HistorySource;
import com.careline.checkin.model.CheckInHistoryFilter;
import com.careline.checkin.model.CheckInRecord;
import com.careline.checkin.model.GuidanceTip;
import com.careline.checkin.trend.TextCategorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tips for the symptoms and concerns of a subject's newest check-in.
 */
@Service
public class GuidanceService {

    private static final Logger logger = LoggerFactory.getLogger(GuidanceService.class);

    private final HistorySource historySource;
    private final TextCategorizer symptomCategorizer;
    private final TextCategorizer concernCategorizer;
    private final GuidanceProvider guidanceProvider;

    public GuidanceService(HistorySource historySource,
                           @Qualifier("symptomCategorizer") TextCategorizer symptomCategorizer,
                           @Qualifier("concernCategorizer") TextCategorizer concernCategorizer,
                           GuidanceProvider guidanceProvider) {
        this.historySource = historySource;
        this.symptomCategorizer = symptomCategorizer;
        this.concernCategorizer = concernCategorizer;
        this.guidanceProvider = guidanceProvider;
    }

    /**
     * @return matching tips, empty when the subject has no check-ins or nothing matches
     */
    public Mono<List<GuidanceTip>> guidanceFor(String subjectId) {
        return historySource.fetchHistory(subjectId, CheckInHistoryFilter.builder().limit(1).build())
            .map(newest -> newest.isEmpty() ? List.<GuidanceTip>of() : tipsFor(newest.get(0)))
            .doOnSuccess(tips -> logger.debug("Found {} guidance tips for subject {}",
                tips == null ? 0 : tips.size(), subjectId));
    }

    private List<GuidanceTip> tipsFor(CheckInRecord checkIn) {
        return guidanceProvider.tips(
            symptomCategorizer.categorize(checkIn.getSymptoms()),
            concernCategorizer.categorize(checkIn.getConcerns()));
    }
}
