package com.github.salilvnair.orderbot.engine.factory;

import com.github.salilvnair.orderbot.audit.AuditService;
import com.github.salilvnair.orderbot.audit.DialogueAuditStage;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.engine.hook.DialogueStepHook;
import com.github.salilvnair.orderbot.engine.model.StepTiming;
import com.github.salilvnair.orderbot.engine.pipeline.DialoguePipeline;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.TerminalStep;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Orders the discovered {@link DialogueStep} beans by their {@code @MustRunAfter} /
 * {@code @MustRunBefore} constraints, with the single {@link TerminalStep} last, and wraps
 * each step with timing, hooks and audit.
 */
@RequiredArgsConstructor
@Component
public class DialoguePipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(DialoguePipelineFactory.class);

    private final List<DialogueStep> discoveredSteps;
    private final List<DialogueStepHook> stepHooks;
    private final AuditService audit;

    private DialoguePipeline pipeline;

    @PostConstruct
    public void init() {
        List<DialogueStep> ordered = orderByDag(discoveredSteps);
        log.info(
                "OrderBot pipeline order: {}",
                ordered.stream()
                        .map(s -> s.getClass().getSimpleName())
                        .collect(Collectors.joining(" -> "))
        );
        this.pipeline = new DialoguePipeline(wrapWithTiming(ordered));
    }

    public DialoguePipeline create() {
        return pipeline;
    }

    List<DialogueStep> orderByDag(List<DialogueStep> steps) {
        Map<Class<?>, DialogueStep> stepByClass = new LinkedHashMap<>();
        for (DialogueStep s : steps) {
            if (stepByClass.put(s.getClass(), s) != null) {
                throw new DialogueEngineException(
                        DialogueEngineErrorCode.DUPLICATE_DIALOGUE_STEP,
                        "Duplicate DialogueStep bean for class: " + s.getClass().getName()
                );
            }
        }

        Class<?> terminal = singleTerminal(stepByClass.keySet());

        // step -> steps that have to finish before it
        Map<Class<?>, Set<Class<?>>> predecessors = new LinkedHashMap<>();
        stepByClass.keySet().forEach(c -> predecessors.put(c, new HashSet<>()));

        for (Class<?> c : stepByClass.keySet()) {
            MustRunBefore before = c.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends DialogueStep> later : before.value()) {
                    requirePresent(stepByClass, c, later);
                    predecessors.get(later).add(c);
                }
            }
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends DialogueStep> earlier : after.value()) {
                    requirePresent(stepByClass, c, earlier);
                    predecessors.get(c).add(earlier);
                }
            }
            if (!c.equals(terminal)) {
                predecessors.get(terminal).add(c);
            }
        }
        predecessors.forEach((c, deps) -> deps.remove(c));

        return resolveOrder(predecessors).stream().map(stepByClass::get).toList();
    }

    private Class<?> singleTerminal(Set<Class<?>> stepClasses) {
        List<Class<?>> terminals = stepClasses.stream()
                .filter(c -> c.isAnnotationPresent(TerminalStep.class))
                .toList();
        if (terminals.size() != 1) {
            throw new DialogueEngineException(
                    DialogueEngineErrorCode.MISSING_TERMINAL_STEP,
                    "Exactly ONE @TerminalStep required, found: " +
                            terminals.stream().map(Class::getSimpleName).collect(Collectors.joining(", "))
            );
        }
        return terminals.get(0);
    }

    private void requirePresent(Map<Class<?>, DialogueStep> stepByClass, Class<?> owner, Class<?> dep) {
        if (!stepByClass.containsKey(dep)) {
            throw new DialogueEngineException(
                    DialogueEngineErrorCode.MISSING_DEPENDENT_STEP,
                    owner.getSimpleName() + " depends on missing step: " + dep.getName()
            );
        }
    }

    /**
     * Repeatedly emits the ready step with the smallest class name, so the order is stable
     * across restarts whatever order the beans were discovered in.
     */
    private List<Class<?>> resolveOrder(Map<Class<?>, Set<Class<?>>> predecessors) {
        Map<Class<?>, Set<Class<?>>> pending = new HashMap<>();
        predecessors.forEach((c, deps) -> pending.put(c, new HashSet<>(deps)));

        List<Class<?>> ordered = new ArrayList<>();
        while (!pending.isEmpty()) {
            Optional<Class<?>> next = pending.entrySet().stream()
                    .filter(e -> e.getValue().isEmpty())
                    .map(Map.Entry::getKey)
                    .min(Comparator.comparing(Class::getName));
            if (next.isEmpty()) {
                throw new DialogueEngineException(
                        DialogueEngineErrorCode.PIPELINE_DAG_CYCLE,
                        "DialogueStep DAG cycle or unsatisfied constraints: " +
                                pending.keySet().stream()
                                        .map(Class::getSimpleName)
                                        .sorted()
                                        .collect(Collectors.joining(", "))
                );
            }
            Class<?> done = next.get();
            pending.remove(done);
            pending.values().forEach(deps -> deps.remove(done));
            ordered.add(done);
        }
        return ordered;
    }

    private List<DialogueStep> wrapWithTiming(List<DialogueStep> steps) {
        return steps.stream()
                .map(s -> (DialogueStep) new TimingDialogueStep(s, stepHooks, audit))
                .toList();
    }

    private static final class TimingDialogueStep implements DialogueStep {

        private final DialogueStep delegate;
        private final List<DialogueStepHook> stepHooks;
        private final AuditService audit;

        private TimingDialogueStep(DialogueStep delegate, List<DialogueStepHook> stepHooks, AuditService audit) {
            this.delegate = delegate;
            this.stepHooks = stepHooks == null ? List.of() : stepHooks;
            this.audit = audit;
        }

        @Override
        public StepResult execute(DialogueContext context) {
            long start = System.nanoTime();
            String stepName = delegate.getClass().getSimpleName();
            DialogueStep.Name name = DialogueStep.Name.fromStepName(stepName);
            StepTiming timing = StepTiming.builder().stepName(stepName).startedAtNs(start).build();

            audit.audit(DialogueAuditStage.STEP_ENTER, context.getUserId(), stepPayload(context, stepName, Map.of()));
            fireHooks("beforeStep", stepName, name, context, hook -> hook.beforeStep(name, context));
            try {
                StepResult r = delegate.execute(context);
                timing.setDurationMs(elapsedMs(start));
                timing.setSuccess(true);
                timing.setStoppedPipeline(r instanceof StepResult.Stop);
                context.getStepTimings().add(timing);
                fireHooks("afterStep", stepName, name, context, hook -> hook.afterStep(name, context, r));
                audit.audit(DialogueAuditStage.STEP_EXIT, context.getUserId(), stepPayload(context, stepName, Map.of(
                        "outcome", r.getClass().getSimpleName(),
                        "durationMs", timing.getDurationMs())));
                return r;
            } catch (RuntimeException e) {
                timing.setDurationMs(elapsedMs(start));
                timing.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
                context.getStepTimings().add(timing);
                fireHooks("onStepError", stepName, name, context, hook -> hook.onStepError(name, context, e));
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("durationMs", timing.getDurationMs());
                error.put("errorType", e.getClass().getSimpleName());
                error.put("errorMessage", String.valueOf(e.getMessage()));
                if (e instanceof DialogueEngineException engineException && engineException.getMetaData() != null) {
                    error.put("_errorMeta", engineException.getMetaData());
                }
                audit.audit(DialogueAuditStage.STEP_ERROR, context.getUserId(), stepPayload(context, stepName, error));
                throw e;
            }
        }

        /** Hooks run only for steps they support; a failing hook is audited and never fails the step. */
        private void fireHooks(
                String phase,
                String stepName,
                DialogueStep.Name name,
                DialogueContext context,
                Consumer<DialogueStepHook> call
        ) {
            for (DialogueStepHook hook : stepHooks) {
                try {
                    if (hook.supports(name, context)) {
                        call.accept(hook);
                    }
                } catch (RuntimeException ex) {
                    log.warn("DialogueStepHook {} failed during {} for step {} userId={}: {}",
                            hook.getClass().getSimpleName(), phase, stepName, context.getUserId(), ex.getMessage());
                    audit.audit(DialogueAuditStage.STEP_HOOK_ERROR, context.getUserId(), stepPayload(context, stepName, Map.of(
                            "phase", phase,
                            "hookClass", hook.getClass().getName(),
                            "errorType", ex.getClass().getSimpleName(),
                            "errorMessage", String.valueOf(ex.getMessage()))));
                }
            }
        }

        private static long elapsedMs(long startNs) {
            return (System.nanoTime() - startNs) / 1_000_000;
        }

        private static Map<String, Object> stepPayload(DialogueContext context, String stepName, Map<String, Object> extra) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("step", stepName);
            payload.putAll(extra);
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("intent", context.getIntent());
            meta.put("state", context.getDialogueState() == null ? null : context.getDialogueState().value());
            payload.put("_meta", meta);
            return payload;
        }
    }
}
