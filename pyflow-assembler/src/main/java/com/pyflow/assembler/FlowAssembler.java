package com.pyflow.assembler;

import com.pyflow.model.Flow;
import com.pyflow.model.transform.FlowStep;

import java.util.List;

/**
 * Turns the ordered output of one analyzer run into a dataset and recipe graph.
 * Implementations hold per-run state; use one instance per conversion.
 *
 * @param <T> step record produced by the analyzer
 */
public interface FlowAssembler<T extends FlowStep> {

    /**
     * Builds a flow from the steps in order.
     *
     * @throws com.pyflow.model.CyclicFlowException when the finished graph contains a cycle
     */
    Flow assemble(List<T> steps);
}
