package com.coursegen.core.graph;

import com.coursegen.core.nodes.DispatchUnitsNode;
import com.coursegen.core.nodes.FinalizeRunNode;
import com.coursegen.core.nodes.PlanUnitsNode;
import com.coursegen.core.nodes.RouteRequestNode;
import com.coursegen.core.state.GenerationState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one generation invocation.
 * <pre>
 *   START -> route_request -> [routeAfterRequest]
 *            -> plan_units -> [routeAfterPlan]
 *               -> dispatch_units -> finalize_run -> END
 *               -> finalize_run -> END   (structural error)
 *            -> finalize_run -> END      (structural error)
 * </pre>
 * Run state is persisted by the result accumulator, so the graph is compiled without a checkpoint saver.
 */
@Component
public class GenerationGraph {

    private static final Logger log = LoggerFactory.getLogger(GenerationGraph.class);

    private final CompiledGraph<GenerationState> compiledGraph;

    public GenerationGraph(
            RouteRequestNode routeNode,
            PlanUnitsNode planNode,
            DispatchUnitsNode dispatchNode,
            FinalizeRunNode finalizeNode) throws Exception {

        var graph = new StateGraph<>(GenerationState.SCHEMA, GenerationState::new)
                .addNode("route_request", node_async(routeNode::apply))
                .addNode("plan_units", node_async(planNode::apply))
                .addNode("dispatch_units", node_async(dispatchNode::apply))
                .addNode("finalize_run", node_async(finalizeNode::apply))
                .addEdge(START, "route_request")
                .addConditionalEdges("route_request",
                        edge_async(this::routeAfterRequest),
                        Map.of("plan_units", "plan_units",
                                "finalize_run", "finalize_run"))
                .addConditionalEdges("plan_units",
                        edge_async(this::routeAfterPlan),
                        Map.of("dispatch_units", "dispatch_units",
                                "finalize_run", "finalize_run"))
                .addEdge("dispatch_units", "finalize_run")
                .addEdge("finalize_run", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Generation graph compiled");
    }

    String routeAfterRequest(GenerationState state) {
        return state.hasStructuralErrors() ? "finalize_run" : "plan_units";
    }

    String routeAfterPlan(GenerationState state) {
        return state.hasStructuralErrors() ? "finalize_run" : "dispatch_units";
    }

    public CompiledGraph<GenerationState> getCompiledGraph() {
        return compiledGraph;
    }
}
