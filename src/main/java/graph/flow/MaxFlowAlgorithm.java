package graph.flow;

/**
 * Common contract of the max-flow routines.
 *
 * <p>Implementations start from the flow already on the network (normally zero), leave a
 * maximum flow on the edges and return its value.</p>
 */
public interface MaxFlowAlgorithm {

    long maxFlow(FlowNetwork network, int s, int t);
}
