package com.eainde.supportagent.workflow;

import com.eainde.supportagent.edges.RouteBranch;
import com.eainde.supportagent.edges.RouteBranchEdge;
import com.eainde.supportagent.nodes.AskNode;
import com.eainde.supportagent.nodes.CompleteNode;
import com.eainde.supportagent.nodes.CreateResponseNode;
import com.eainde.supportagent.nodes.DecideNode;
import com.eainde.supportagent.nodes.DoNode;
import com.eainde.supportagent.nodes.IntakeNode;
import com.eainde.supportagent.nodes.PrepareNode;
import com.eainde.supportagent.nodes.RetrieveNode;
import com.eainde.supportagent.nodes.RouteNode;
import com.eainde.supportagent.nodes.UnderstandNode;
import com.eainde.supportagent.nodes.UpdateTicketNode;
import com.eainde.supportagent.nodes.WaitNode;
import com.eainde.supportagent.state.SupportState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.eainde.supportagent.nodes.StageNames.ASK;
import static com.eainde.supportagent.nodes.StageNames.COMPLETE;
import static com.eainde.supportagent.nodes.StageNames.CREATE;
import static com.eainde.supportagent.nodes.StageNames.DECIDE;
import static com.eainde.supportagent.nodes.StageNames.DO;
import static com.eainde.supportagent.nodes.StageNames.INTAKE;
import static com.eainde.supportagent.nodes.StageNames.PREPARE;
import static com.eainde.supportagent.nodes.StageNames.RETRIEVE;
import static com.eainde.supportagent.nodes.StageNames.ROUTE;
import static com.eainde.supportagent.nodes.StageNames.UNDERSTAND;
import static com.eainde.supportagent.nodes.StageNames.UPDATE;
import static com.eainde.supportagent.nodes.StageNames.WAIT;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the support stages into a langgraph4j graph.
 *
 * <pre>
 * START → INTAKE → UNDERSTAND → PREPARE → ASK → WAIT → RETRIEVE → DECIDE → ROUTE
 * ROUTE ─(UPDATE)→ UPDATE ─┐
 * ROUTE ─(CREATE)→ CREATE ─┴→ DO → COMPLETE → END
 * </pre>
 */
@Component
public class SupportWorkflowGraph {
    private final IntakeNode intakeNode;
    private final UnderstandNode understandNode;
    private final PrepareNode prepareNode;
    private final AskNode askNode;
    private final WaitNode waitNode;
    private final RetrieveNode retrieveNode;
    private final DecideNode decideNode;
    private final RouteNode routeNode;
    private final UpdateTicketNode updateTicketNode;
    private final CreateResponseNode createResponseNode;
    private final DoNode doNode;
    private final CompleteNode completeNode;
    private final RouteBranchEdge routeBranchEdge;

    public SupportWorkflowGraph(
            IntakeNode intakeNode,
            UnderstandNode understandNode,
            PrepareNode prepareNode,
            AskNode askNode,
            WaitNode waitNode,
            RetrieveNode retrieveNode,
            DecideNode decideNode,
            RouteNode routeNode,
            UpdateTicketNode updateTicketNode,
            CreateResponseNode createResponseNode,
            DoNode doNode,
            CompleteNode completeNode,
            RouteBranchEdge routeBranchEdge) {
        this.intakeNode = intakeNode;
        this.understandNode = understandNode;
        this.prepareNode = prepareNode;
        this.askNode = askNode;
        this.waitNode = waitNode;
        this.retrieveNode = retrieveNode;
        this.decideNode = decideNode;
        this.routeNode = routeNode;
        this.updateTicketNode = updateTicketNode;
        this.createResponseNode = createResponseNode;
        this.doNode = doNode;
        this.completeNode = completeNode;
        this.routeBranchEdge = routeBranchEdge;
    }

    // Compiled once; the graph holds no per-run state and is shared by concurrent runs.
    @Bean("supportWorkflow")
    public CompiledGraph<SupportState> build() throws GraphStateException {

        StateGraph<SupportState> workflow = new StateGraph<>(SupportState.SCHEMA, SupportState::new);

        workflow.addNode(INTAKE, intakeNode);
        workflow.addNode(UNDERSTAND, understandNode);
        workflow.addNode(PREPARE, prepareNode);
        workflow.addNode(ASK, askNode);
        workflow.addNode(WAIT, waitNode);
        workflow.addNode(RETRIEVE, retrieveNode);
        workflow.addNode(DECIDE, decideNode);
        workflow.addNode(ROUTE, routeNode);
        workflow.addNode(UPDATE, updateTicketNode);
        workflow.addNode(CREATE, createResponseNode);
        workflow.addNode(DO, doNode);
        workflow.addNode(COMPLETE, completeNode);

        workflow.addEdge(START, INTAKE);
        workflow.addEdge(INTAKE, UNDERSTAND);
        workflow.addEdge(UNDERSTAND, PREPARE);
        workflow.addEdge(PREPARE, ASK);
        workflow.addEdge(ASK, WAIT);
        workflow.addEdge(WAIT, RETRIEVE);
        workflow.addEdge(RETRIEVE, DECIDE);
        workflow.addEdge(DECIDE, ROUTE);

        workflow.addConditionalEdges(
                ROUTE,
                routeBranchEdge,
                Map.of(
                        RouteBranch.UPDATE.name(), RouteBranch.UPDATE.targetNode(),
                        RouteBranch.CREATE.name(), RouteBranch.CREATE.targetNode()
                )
        );

        workflow.addEdge(UPDATE, DO);
        workflow.addEdge(CREATE, DO);
        workflow.addEdge(DO, COMPLETE);
        workflow.addEdge(COMPLETE, END);

        return workflow.compile();
    }
}
