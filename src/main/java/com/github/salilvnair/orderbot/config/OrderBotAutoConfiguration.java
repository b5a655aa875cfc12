package com.github.salilvnair.orderbot.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.orderbot")
@ComponentScan(basePackages = "com.github.salilvnair.orderbot")
@EntityScan(basePackages = "com.github.salilvnair.orderbot.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.orderbot.repo")
public class OrderBotAutoConfiguration {

    /** Time source for suggestion expiry and timestamps; hosts may override it. */
    @Bean
    @ConditionalOnMissingBean
    public Clock orderBotClock() {
        return Clock.systemUTC();
    }
}
