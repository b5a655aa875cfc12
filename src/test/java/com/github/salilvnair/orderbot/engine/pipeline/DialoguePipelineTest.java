package com.github.salilvnair.orderbot.engine.pipeline;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.salilvnair.orderbot.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.*;

class DialoguePipelineTest {

    @Test
    void stopsAtFirstStopResult() {
        List<String> calls = new ArrayList<>();
        ResponseEnvelope envelope = ResponseEnvelope.builder().success(true).botResponse("done").build();
        DialoguePipeline pipeline = new DialoguePipeline(List.of(
                ctx -> {
                    calls.add("a");
                    return new StepResult.Continue();
                },
                ctx -> {
                    calls.add("b");
                    return new StepResult.Stop(envelope);
                },
                ctx -> {
                    calls.add("c");
                    return new StepResult.Continue();
                }
        ));

        ResponseEnvelope result = pipeline.execute(new DialogueContext(USER_ID, "hi"));

        assertSame(envelope, result);
        assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void returnsFinalResponseWhenNoStepStops() {
        ResponseEnvelope envelope = ResponseEnvelope.builder().success(true).build();
        DialoguePipeline pipeline = new DialoguePipeline(List.of(ctx -> {
            ctx.setFinalResponse(envelope);
            return new StepResult.Continue();
        }));

        assertSame(envelope, pipeline.execute(new DialogueContext(USER_ID, "hi")));
    }

    @Test
    void throwsWhenNoStepProducedResult() {
        DialoguePipeline pipeline = new DialoguePipeline(List.of(ctx -> new StepResult.Continue()));

        DialogueEngineException ex = assertThrows(DialogueEngineException.class,
                () -> pipeline.execute(new DialogueContext(USER_ID, "hi")));
        assertEquals(DialogueEngineErrorCode.PIPELINE_NO_FINAL_RESULT.name(), ex.getErrorCode());
    }
}
