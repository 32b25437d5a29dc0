package com.eainde.dealflow.workflow;

import com.eainde.dealflow.model.FlowType;
import com.eainde.dealflow.nodes.ComplyNode;
import com.eainde.dealflow.nodes.GenerateNode;
import com.eainde.dealflow.nodes.RetrieveNode;
import com.eainde.dealflow.state.ProposalState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ProposalWorkflowGraph {

    private final RetrieveNode retrieveNode;
    private final GenerateNode generateNode;
    private final ComplyNode complyNode;

    @Bean("proposalWorkflow")
    public StageGraph<ProposalState> build() throws GraphStateException {
        return new StageGraph<>(FlowType.PROPOSAL, ProposalState::new, List.of(
                new Stage<>(RetrieveNode.NAME, "Proposal context retrieved", retrieveNode),
                new Stage<>(GenerateNode.NAME, "Proposal draft generated", generateNode),
                new Stage<>(ComplyNode.NAME, "Compliance checked", complyNode)));
    }
}
