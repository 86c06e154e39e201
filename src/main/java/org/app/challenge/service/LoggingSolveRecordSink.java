package org.app.challenge.service;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.model.SolveRecord;

/**
 * Default sink for deployments without a reporting store.
 */
@Slf4j
public class LoggingSolveRecordSink implements SolveRecordSink {

    @Override
    public void record(SolveRecord solveRecord) {
        log.info("Solve recorded: scenario={} difficulty={} solvedAt={} classification={} attempts={}",
                solveRecord.scenarioKey(), solveRecord.difficulty(), solveRecord.solvedAt(),
                solveRecord.classification(), solveRecord.attemptCount());
    }
}
