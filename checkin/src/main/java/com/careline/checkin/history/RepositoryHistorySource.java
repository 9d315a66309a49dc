package com.careline.checkin.history;

import com.careline.checkin.exception.HistoryUnavailableException;
import com.careline.checkin.exception.SubjectNotFoundException;
import com.careline.checkin.model.CheckInEntity;
import com.careline.checkin.model.CheckInHistoryFilter;
import com.careline.checkin.model.CheckInRecord;
import com.careline.checkin.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.dialect.Escaper;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Component
public class RepositoryHistorySource implements HistorySource {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryHistorySource.class);

    /** Keywords match literally; H2 uses backslash as the default LIKE escape. */
    private static final Escaper LIKE_ESCAPER = Escaper.DEFAULT;

    private final R2dbcEntityTemplate template;
    private final SubjectRepository subjectRepository;

    public RepositoryHistorySource(R2dbcEntityTemplate template, SubjectRepository subjectRepository) {
        this.template = template;
        this.subjectRepository = subjectRepository;
    }

    @Override
    public Mono<List<CheckInRecord>> fetchHistory(String subjectId, CheckInHistoryFilter filter) {
        CheckInHistoryFilter effective = filter == null ? CheckInHistoryFilter.builder().build() : filter;

        return subjectRepository.existsBySubjectId(subjectId)
            .flatMap(exists -> {
                if (!exists) {
                    return Mono.<List<CheckInRecord>>error(new SubjectNotFoundException(subjectId));
                }
                return template.select(CheckInEntity.class)
                    .matching(buildQuery(subjectId, effective))
                    .all()
                    .map(CheckInEntity::toRecord)
                    .collectList();
            })
            .doOnSuccess(records -> logger.debug("Fetched {} check-ins for subject {}",
                records == null ? 0 : records.size(), subjectId))
            .onErrorMap(error -> !(error instanceof HistoryUnavailableException),
                error -> new HistoryUnavailableException(
                    "History query failed for subject " + subjectId, error));
    }

    private Query buildQuery(String subjectId, CheckInHistoryFilter filter) {
        Criteria criteria = Criteria.where("subjectId").is(subjectId);

        if (filter.getStartDate() != null) {
            criteria = criteria.and("createdAt").greaterThanOrEquals(toUtc(filter.getStartDate()));
        }
        if (filter.getEndDate() != null) {
            criteria = criteria.and("createdAt").lessThanOrEquals(toUtc(filter.getEndDate()));
        }

        String keyword = filter.normalizedKeyword();
        if (keyword != null) {
            String pattern = "%" + LIKE_ESCAPER.escape(keyword) + "%";
            criteria = criteria.and(
                Criteria.where("symptoms").like(pattern).ignoreCase(true)
                    .or("concerns").like(pattern).ignoreCase(true));
        }

        Query query = Query.query(criteria)
            .sort(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("storedAt")));

        Integer limit = filter.normalizedLimit();
        if (limit != null) {
            query = query.limit(limit);
        }
        return query;
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
