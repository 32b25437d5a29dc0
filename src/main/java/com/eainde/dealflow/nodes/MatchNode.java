package com.eainde.dealflow.nodes;

import com.eainde.dealflow.matching.CapabilityMatcher;
import com.eainde.dealflow.model.RoleMatch;
import com.eainde.dealflow.state.QualificationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Qualification stage 4: runs every key role of the gap assessment through the
 * capability matcher. No reasoning call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchNode implements AsyncNodeAction<QualificationState> {

    public static final String NAME = "match";
    static final int CANDIDATES_PER_ROLE = 3;

    private final CapabilityMatcher matcher;

    @Override
    public CompletableFuture<Map<String, Object>> apply(QualificationState state) {
        List<RoleMatch> matches = state.getGapAnalysis().keyRoles().stream()
                .map(role -> matcher.matchRole(role, state.getRoster(), CANDIDATES_PER_ROLE))
                .toList();
        long covered = matches.stream().filter(m -> RoleMatch.COVERED.equals(m.status())).count();
        log.info("Matched {} key roles against {} employees, {} covered",
                matches.size(), state.getRoster().size(), covered);
        return CompletableFuture.completedFuture(Map.of(QualificationState.ROLE_MATCHES, matches));
    }
}
