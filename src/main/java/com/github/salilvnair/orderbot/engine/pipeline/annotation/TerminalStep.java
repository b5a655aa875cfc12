package com.github.salilvnair.orderbot.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the single step that always runs last and produces the final response.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}
