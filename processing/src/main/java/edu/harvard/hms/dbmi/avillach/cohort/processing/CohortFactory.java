package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.cohort.processing.temporal.TemporalJoinService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class CohortFactory {

    private final ConditionEngine conditionEngine;

    private final TemporalJoinService temporalJoinService;

    @Autowired
    public CohortFactory(ConditionEngine conditionEngine, TemporalJoinService temporalJoinService) {
        this.conditionEngine = conditionEngine;
        this.temporalJoinService = temporalJoinService;
    }

    public Cohort create(Predicate predicate) {
        return create(predicate, null);
    }

    public Cohort create(Predicate predicate, Integer limit) {
        return new Cohort(conditionEngine, temporalJoinService, predicate, limit);
    }
}
