package com.mesh.registry.dto;

import lombok.Value;

@Value
public class MetricDelta {
    double v1;
    double v2;
    double diff;
    boolean improved;

    public static MetricDelta of(double v1, double v2) {
        return new MetricDelta(v1, v2, v2 - v1, v2 > v1);
    }
}
