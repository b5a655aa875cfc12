package com.github.salilvnair.orderbot.template;

import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders prompt text with Thymeleaf in TEXT mode. Besides native {@code [(${x})]} inlining,
 * {@code {{x}}} placeholders are accepted and rewritten before processing.
 */
@Component
public class ThymeleafTemplateRenderer {

    private static final Pattern LEGACY_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;
    private final Map<String, String> resourceCache = new ConcurrentHashMap<>();

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Context context = new Context();
        context.setVariables(variables == null ? Map.of() : new LinkedHashMap<>(variables));
        try {
            String rendered = templateEngine.process(normalizeTemplate(raw), context);
            return rendered == null ? "" : rendered;
        } catch (RuntimeException e) {
            throw new DialogueEngineException(DialogueEngineErrorCode.PROMPT_RENDER_FAILED,
                    "Failed to render prompt: " + e.getMessage(), e);
        }
    }

    /** Renders a template stored on the classpath, e.g. {@code prompts/extract-intent.txt}. */
    public String renderResource(String classpathLocation, Map<String, Object> variables) {
        return render(loadResource(classpathLocation), variables);
    }

    public String loadResource(String classpathLocation) {
        return resourceCache.computeIfAbsent(classpathLocation, location -> {
            ClassPathResource resource = new ClassPathResource(location);
            try (InputStream in = resource.getInputStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new DialogueEngineException(DialogueEngineErrorCode.PROMPT_RENDER_FAILED,
                        "Prompt template not found: " + location, e);
            }
        });
    }

    private String normalizeTemplate(String template) {
        Matcher matcher = LEGACY_VAR_PATTERN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement("[(${" + matcher.group(1).trim() + "})]"));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
