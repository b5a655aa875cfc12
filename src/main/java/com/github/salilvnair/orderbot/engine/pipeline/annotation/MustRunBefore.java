package com.github.salilvnair.orderbot.engine.pipeline.annotation;

import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunBefore {
    Class<? extends DialogueStep>[] value();
}
