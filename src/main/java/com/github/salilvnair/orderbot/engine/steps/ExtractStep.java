package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.nlp.HybridExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractStep implements DialogueStep {

    private final HybridExtractor extractor;

    @Override
    public StepResult execute(DialogueContext context) {
        ExtractionResult extraction = extractor.extract(context.getUserMessage());
        context.applyExtraction(extraction);
        log.debug("userId={} intent={} source={} entities={} batchItems={}",
                context.getUserId(), extraction.intent(), extraction.source().value(),
                extraction.entities(), extraction.batchItems().size());
        return new StepResult.Continue();
    }
}
