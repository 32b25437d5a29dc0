package com.eainde.dealflow.run;

import com.eainde.dealflow.model.RunSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Lifecycle table of runs. Safe for concurrent use by any number of runs and
 * readers.
 */
public interface RunRegistry {

    /**
     * Adds a new run.
     *
     * @return ids of runs evicted to make room
     * @throws IllegalStateException when the run id is already taken
     */
    List<String> register(RunSnapshot snapshot);

    Optional<RunSnapshot> find(String runId);

    /**
     * Atomically replaces the run's snapshot with {@code transition} applied to it.
     *
     * @throws UnknownRunException   when there is no such run
     * @throws IllegalStateException when the transition is illegal
     */
    RunSnapshot update(String runId, UnaryOperator<RunSnapshot> transition);

    int size();
}
