package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class GraphProperties {

    @Min(1)
    private int maxTraversalDepth = 10;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double defaultEdgeWeight = 1.0;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double impactDecayFactor = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double impactThreshold = 0.1;

    @Min(1)
    private int impactMaxDistance = 3;

    @NotEmpty
    private List<String> defaultDependencyTypes = new ArrayList<>(List.of("depends-on", "requires"));

    @NotEmpty
    private List<String> defaultImpactTypes = new ArrayList<>(List.of("depends-on", "parent", "references"));

    @NotEmpty
    private List<String> cycleTypes = new ArrayList<>(List.of("depends-on", "requires"));
}
