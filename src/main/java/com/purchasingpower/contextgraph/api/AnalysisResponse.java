package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.model.graph.GraphPosition;
import com.purchasingpower.contextgraph.model.graph.ImpactAnalysisReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    private ImpactAnalysisReport report;
    private GraphPosition position;
    private String markdown;
}
