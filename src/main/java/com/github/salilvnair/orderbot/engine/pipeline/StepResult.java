package com.github.salilvnair.orderbot.engine.pipeline;

import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(ResponseEnvelope result) implements StepResult {}
}
