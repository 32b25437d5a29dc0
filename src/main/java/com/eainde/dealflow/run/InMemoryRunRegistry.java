package com.eainde.dealflow.run;

import com.eainde.dealflow.model.RunSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link RunRegistry} on a {@link ConcurrentHashMap}. Transitions are atomic per
 * run. Once more than {@code maxRetained} runs are held, the least recently
 * updated finished runs are evicted; active runs are never evicted.
 */
@Slf4j
@Component
public class InMemoryRunRegistry implements RunRegistry {

    private final Map<String, RunSnapshot> runs = new ConcurrentHashMap<>();
    private final int maxRetained;

    public InMemoryRunRegistry(@Value("${dealflow.runs.max-retained:500}") int maxRetained) {
        if (maxRetained < 1) {
            throw new IllegalArgumentException("dealflow.runs.max-retained must be positive");
        }
        this.maxRetained = maxRetained;
    }

    @Override
    public List<String> register(RunSnapshot snapshot) {
        if (runs.putIfAbsent(snapshot.runId(), snapshot) != null) {
            throw new IllegalStateException("Run id already in use: " + snapshot.runId());
        }
        return runs.size() > maxRetained ? evict() : List.of();
    }

    @Override
    public Optional<RunSnapshot> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public RunSnapshot update(String runId, UnaryOperator<RunSnapshot> transition) {
        RunSnapshot updated = runs.computeIfPresent(runId, (id, current) -> transition.apply(current));
        if (updated == null) {
            throw new UnknownRunException(runId);
        }
        return updated;
    }

    @Override
    public int size() {
        return runs.size();
    }

    private synchronized List<String> evict() {
        int excess = runs.size() - maxRetained;
        if (excess <= 0) {
            return List.of();
        }
        List<RunSnapshot> finished = runs.values().stream()
                .filter(snapshot -> snapshot.status().isTerminal())
                .sorted(Comparator.comparing(RunSnapshot::updatedAt))
                .limit(excess)
                .toList();
        List<String> evicted = new ArrayList<>();
        for (RunSnapshot snapshot : finished) {
            // a concurrent update means the snapshot is no longer the least recent
            if (runs.remove(snapshot.runId(), snapshot)) {
                evicted.add(snapshot.runId());
            }
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} finished runs, {} retained", evicted.size(), runs.size());
        }
        return evicted;
    }
}
