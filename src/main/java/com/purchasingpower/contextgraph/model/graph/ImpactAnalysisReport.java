package com.purchasingpower.contextgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactAnalysisReport {

    private String analyzedNode;

    private List<String> directDependencies;
    private List<String> transitiveDependencies;
    private List<String> directDependents;
    private List<String> impactedContexts;
    private List<String> criticalContexts;

    private double impactScore;
    private RiskLevel riskLevel;

    public enum RiskLevel {
        LOW,      // <= 5 impacted
        MEDIUM,   // 6-10 impacted
        HIGH,     // 11-20 impacted
        CRITICAL  // > 20 impacted
    }

    public static RiskLevel riskFor(int impactedCount) {
        if (impactedCount > 20) return RiskLevel.CRITICAL;
        if (impactedCount > 10) return RiskLevel.HIGH;
        if (impactedCount > 5) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    public String toMarkdown() {
        return String.format("""
            # Impact Analysis: %s

            ## Risk Assessment
            - **Risk Level**: %s
            - **Impact Score**: %.1f/10

            ## Dependencies
            - Direct: %d contexts
            - Transitive: %d contexts

            ## Impacted (Who depends on this?)
            - Direct: %d contexts
            - Within impact threshold: %d contexts

            ## Critical Contexts
            %s

            ## Recommendation
            %s
            """,
            analyzedNode,
            riskLevel,
            impactScore,
            directDependencies.size(),
            transitiveDependencies.size(),
            directDependents.size(),
            impactedContexts.size(),
            criticalContexts.isEmpty() ? "None" : String.join("\n", criticalContexts.stream().map(p -> "- " + p).toList()),
            getRecommendation()
        );
    }

    private String getRecommendation() {
        return switch (riskLevel) {
            case CRITICAL -> "HIGH RISK: a change reaches 20+ contexts. Stage it and re-check dependents.";
            case HIGH -> "MODERATE RISK: review every impacted context before applying the change.";
            case MEDIUM -> "MANAGEABLE: verify the directly impacted contexts.";
            case LOW -> "LOW RISK: few contexts depend on this one.";
        };
    }
}
