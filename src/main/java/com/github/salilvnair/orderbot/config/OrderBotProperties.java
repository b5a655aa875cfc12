package com.github.salilvnair.orderbot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "orderbot")
@Getter
@Setter
public class OrderBotProperties {

    private Dialogue dialogue = new Dialogue();
    private Recommendations recommendations = new Recommendations();
    private Llm llm = new Llm();
    private Menu menu = new Menu();

    @Getter
    @Setter
    public static class Dialogue {
        private int historyLimit = 20;
        private int promptHistory = 10;
        private int pendingActionMaxRetries = 3;
        private Duration suggestionTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Recommendations {
        private boolean enabled = true;
        private int maxItems = 2;
    }

    @Getter
    @Setter
    public static class Llm {
        private boolean enabled = false;
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey;
        private String model = "llama-3.3-70b-versatile";
        private double temperature = 0.1d;
        private int maxTokens = 300;
        private Duration timeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Menu {
        private boolean seed = true;
    }
}
