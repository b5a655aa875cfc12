package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.suggestion.SuggestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class RejectionHandler implements IntentHandler {

    private final SuggestionService suggestionService;

    @Override
    public String name() {
        return IntentCode.REJECTION;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.REJECTION);
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        boolean ar = LanguageCode.isArabic(context.getLanguage());
        boolean hadSuggestion = suggestionService.clear(context.getSessionState());
        String message;
        if (hadSuggestion) {
            message = ar ? "ماشي! عايز تطلب إيه بدلها؟" : "No problem! What would you like to order instead?";
        } else {
            message = ar ? "تمام! أقدر أساعدك إزاي؟" : "Okay! How can I help you?";
        }
        Map<String, Object> result = HandlerResults.success(message);
        result.put("suggestion_cleared", hadSuggestion);
        context.setHandlerResult(result);
        return context;
    }
}
