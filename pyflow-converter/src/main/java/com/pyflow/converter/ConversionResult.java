package com.pyflow.converter;

import com.pyflow.llm.AnalysisResult;
import com.pyflow.model.Flow;
import com.pyflow.model.FlowWarning;
import com.pyflow.model.transform.Transformation;
import com.pyflow.optimizer.OptimizationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one conversion.
 *
 * @param flow            the assembled (and, when enabled, optimized) flow
 * @param transformations static analyzer output; empty after a semantic analysis
 * @param analysis        semantic analyzer output; null after a static analysis
 * @param optimization    what the optimizer changed; null when optimization is disabled
 */
public record ConversionResult(Flow flow,
                               List<Transformation> transformations,
                               AnalysisResult analysis,
                               OptimizationResult optimization) {

    public ConversionResult {
        transformations = transformations != null ? List.copyOf(transformations) : List.of();
    }

    /** Model warnings first, then everything assembly and optimization recorded on the flow. */
    public List<FlowWarning> warnings() {
        List<FlowWarning> out = new ArrayList<>();
        if (analysis != null) {
            for (String w : analysis.warnings()) out.add(FlowWarning.warning(w));
        }
        out.addAll(flow.getWarnings());
        return out;
    }

    public boolean isSemantic() {
        return analysis != null;
    }
}
