package com.appmonitor.collector.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendAnalysis {

    public enum Trend {
        INCREASING, DECREASING, STABLE, INSUFFICIENT_DATA
    }

    Trend trend;
    double confidence;
    double correlation;
    int dataPoints;

    double mean;
    double standardDeviation;
    double min;
    double max;
    double latest;
    double changeFromStart;

    public static TrendAnalysis insufficient(int dataPoints) {
        return TrendAnalysis.builder()
                .trend(Trend.INSUFFICIENT_DATA)
                .dataPoints(dataPoints)
                .build();
    }

    public boolean isConfident(Trend expected, double minConfidence) {
        return trend == expected && confidence > minConfidence;
    }
}
