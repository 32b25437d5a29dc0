package com.eainde.dealflow.workflow;

import com.eainde.dealflow.state.DealState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

/**
 * One named step of a flow.
 *
 * @param name    node name in the graph and stage name in progress events
 * @param message human readable progress text published after the stage
 * @param action  the stage function, returning a partial state update
 */
public record Stage<S extends DealState>(String name, String message, AsyncNodeAction<S> action) {
}
