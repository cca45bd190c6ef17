package graphslick.base.flowchart;

import java.util.Optional;

/**
 * Source of function flowcharts. The host decides how blocks are computed.
 */
public interface FlowChartProvider {

    /**
     * Build the flowchart of the function containing the given address.
     * @param address any address inside the function
     * @return the flowchart, or empty if no function contains the address
     */
    Optional<FlowChart> getFlowChart(long address);
}
