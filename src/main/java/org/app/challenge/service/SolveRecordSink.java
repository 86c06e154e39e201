package org.app.challenge.service;

import org.app.challenge.model.SolveRecord;

/**
 * Durable destination for finalized first solves. Best effort: a failing sink never affects the
 * solve itself.
 */
public interface SolveRecordSink {

    void record(SolveRecord solveRecord);
}
