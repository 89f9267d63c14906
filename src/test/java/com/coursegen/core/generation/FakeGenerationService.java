package com.coursegen.core.generation;

import com.coursegen.core.model.ErrorClass;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Deterministic {@link GenerationService} for tests.
 * <p>
 * Lessons come back with two visual tags; the same ref always yields the same text unless
 * {@link #bumpVersion(String)} was called for it. Failures can be scripted per stage and ref.
 */
public class FakeGenerationService implements GenerationService {

    private final List<GenerationPrompt> prompts = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> versions = new ConcurrentHashMap<>();
    private final Map<String, List<ErrorClass>> scriptedFailures = new ConcurrentHashMap<>();
    private volatile Consumer<GenerationPrompt> onContent = p -> { };

    @Override
    public GenerationResponse generate(GenerationPrompt prompt) {
        prompts.add(prompt);
        String stage = prompt.constraint(GenerationPrompt.STAGE);
        String ref = prompt.constraint(GenerationPrompt.TARGET_REF);

        List<ErrorClass> failures = scriptedFailures.get(stage + "|" + ref);
        if (failures != null) {
            synchronized (failures) {
                if (!failures.isEmpty()) {
                    ErrorClass errorClass = failures.remove(0);
                    throw new GenerationServiceException(errorClass, "scripted " + errorClass + " for " + ref);
                }
            }
        }

        int version = versions.computeIfAbsent(ref, k -> new AtomicInteger()).get();
        return switch (stage) {
            case "content" -> {
                onContent.accept(prompt);
                yield GenerationResponse.ofText("# Lesson " + ref + " v" + version + "\n\n"
                        + "Intro.\n\n[VISUAL: overview of " + ref + "]\n\nBody.\n\n[VISUAL: detail of " + ref + "]\n");
            }
            case "visual-plan" -> GenerationResponse.ofText("Clean diagram: " + prompt.prompt().length());
            case "image-render" -> GenerationResponse.ofBinary(
                    ("png:" + ref + ":v" + version).getBytes(StandardCharsets.UTF_8));
            case "lab-plan" -> GenerationResponse.ofText("Plan for lab " + ref + " v" + version);
            case "lab-write" -> GenerationResponse.ofText("# Lab " + ref + " v" + version + "\n\nSteps.");
            default -> GenerationResponse.ofText("text for " + ref);
        };
    }

    /** Makes every later response for {@code ref} differ from earlier ones. */
    public void bumpVersion(String ref) {
        versions.computeIfAbsent(ref, k -> new AtomicInteger()).incrementAndGet();
    }

    public void failNext(String stage, String ref, ErrorClass... errorClasses) {
        scriptedFailures.put(stage + "|" + ref, new ArrayList<>(List.of(errorClasses)));
    }

    /** Called for every lesson-content prompt before it is answered. */
    public void onContent(Consumer<GenerationPrompt> hook) {
        this.onContent = hook;
    }

    public List<GenerationPrompt> prompts() {
        return List.copyOf(prompts);
    }

    public long count(String stage) {
        return prompts.stream().filter(p -> stage.equals(p.constraint(GenerationPrompt.STAGE))).count();
    }

    public List<String> refsFor(String stage) {
        return prompts.stream()
                .filter(p -> stage.equals(p.constraint(GenerationPrompt.STAGE)))
                .map(p -> p.constraint(GenerationPrompt.TARGET_REF))
                .toList();
    }
}
