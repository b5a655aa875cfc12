package com.github.salilvnair.orderbot.engine.model;

import lombok.*;

/**
 * Wall-clock record of one step run, kept on the context for the turn's audit trail.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StepTiming {
    private String stepName;
    private long startedAtNs;
    private long durationMs;

    private boolean success;
    private boolean stoppedPipeline;
    private String error;
}
