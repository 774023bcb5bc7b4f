package com.geoenrich.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshot {

    private long totalEnrichments;
    private long totalTimeMs;
    private double averageTimeMs;
    private long parallelTasks;
    private long failedTasks;
}
