package com.eainde.dealflow.workflow;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.nodes.AnalyzeNode;
import com.eainde.dealflow.nodes.DecideNode;
import com.eainde.dealflow.nodes.ExtractNode;
import com.eainde.dealflow.nodes.IngestNode;
import com.eainde.dealflow.nodes.MatchNode;
import com.eainde.dealflow.state.QualificationState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class QualificationWorkflowGraph {

    private final IngestNode ingestNode;
    private final ExtractNode extractNode;
    private final AnalyzeNode analyzeNode;
    private final MatchNode matchNode;
    private final DecideNode decideNode;

    @Bean("qualificationWorkflow")
    public StageGraph<QualificationState> build() throws GraphStateException {
        return new StageGraph<>(FlowType.QUALIFICATION, QualificationState::new, List.of(
                new Stage<>(IngestNode.NAME, "Document ingested", ingestNode),
                new Stage<>(ExtractNode.NAME, "Requirements extracted", extractNode),
                new Stage<>(AnalyzeNode.NAME, "Capability gaps analyzed", analyzeNode),
                new Stage<>(MatchNode.NAME, "Key roles matched against the team", matchNode),
                new Stage<>(DecideNode.NAME, "Recommendation made", decideNode)));
    }
}
