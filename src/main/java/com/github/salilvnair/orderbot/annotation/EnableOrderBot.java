package com.github.salilvnair.orderbot.annotation;

import com.github.salilvnair.orderbot.config.OrderBotAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(OrderBotAutoConfiguration.class)
public @interface EnableOrderBot {
}
