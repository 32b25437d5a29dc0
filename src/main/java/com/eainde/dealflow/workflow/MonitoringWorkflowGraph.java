package com.eainde.dealflow.workflow;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.nodes.AlertNode;
import com.eainde.dealflow.nodes.HealthNode;
import com.eainde.dealflow.nodes.RecoveryNode;
import com.eainde.dealflow.nodes.SentimentNode;
import com.eainde.dealflow.state.MonitoringState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class MonitoringWorkflowGraph {

    private final SentimentNode sentimentNode;
    private final HealthNode healthNode;
    private final AlertNode alertNode;
    private final RecoveryNode recoveryNode;

    @Bean("monitoringWorkflow")
    public StageGraph<MonitoringState> build() throws GraphStateException {
        return new StageGraph<>(FlowType.MONITORING, MonitoringState::new, List.of(
                new Stage<>(SentimentNode.NAME, "Communication sentiment analyzed", sentimentNode),
                new Stage<>(HealthNode.NAME, "Deal health calculated", healthNode),
                new Stage<>(AlertNode.NAME, "Risks detected", alertNode),
                new Stage<>(RecoveryNode.NAME, "Recovery strategy prepared", recoveryNode)));
    }
}
