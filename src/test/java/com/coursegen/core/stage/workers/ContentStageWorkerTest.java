package com.coursegen.core.stage.workers;

import com.coursegen.core.generation.FakeGenerationService;
import com.coursegen.core.generation.GenerationPrompt;
import com.coursegen.core.generation.GenerationResponse;
import com.coursegen.core.generation.GenerationService;
import com.coursegen.core.generation.GenerationServiceException;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.ErrorClass;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.model.WorkUnitKind;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.outline.OutlineParser;
import com.coursegen.core.outline.Outlines;
import com.coursegen.core.stage.StageContext;
import com.coursegen.core.storage.FileSystemArtifactStore;
import com.coursegen.core.timeout.MutableClock;
import com.coursegen.core.timeout.TimeoutGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContentStageWorkerTest {

    private static final GenerationContext GEN =
            new GenerationContext("outlines/c.yaml", "courses/c", "openai", Map.of("tone", "formal"));

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore store;
    private CourseOutline outline;
    private MutableClock clock;
    private FakeGenerationService gen;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(tempDir);
        outline = new OutlineParser(store).parse(Outlines.SEVEN_LESSONS);
        clock = new MutableClock();
        gen = new FakeGenerationService();
    }

    private StageContext context(Duration budget) {
        return StageContext.of("R-1", outline, GEN, new TimeoutGuard(budget, clock), null);
    }

    private static WorkUnit unit(String... refs) {
        return new WorkUnit("m01-lessons-1", WorkUnitKind.LESSON_BATCH, List.of(refs), GEN);
    }

    @Test
    @DisplayName("Writes every lesson and stores it under its deterministic key")
    void writesLessons() {
        var output = new ContentStageWorker(gen, store).execute(unit("01-01", "01-02"), context(Duration.ofHours(1)));

        assertFalse(output.partial());
        var entries = output.payload().entries();
        assertEquals(List.of("01-01", "01-02"), output.payload().completedRefs());
        assertEquals(ContentKind.LESSON, entries.get(0).kind());
        assertEquals("Why Containers", entries.get(0).title());
        assertEquals("courses/c/lessons/module-1-lesson-1-why-containers.md", entries.get(0).storageKey());
        assertEquals(entries.get(0).text(), store.getText(entries.get(0).storageKey()).orElseThrow());
    }

    @Test
    @DisplayName("A regeneration pass writes into its revision directory and leaves the committed file alone")
    void regenerationWritesRevisionedKey() {
        var worker = new ContentStageWorker(gen, store);
        var first = worker.execute(unit("01-01"), context(Duration.ofHours(1))).payload().entries().get(0);
        gen.bumpVersion("01-01");
        var reopened = RunState.start("R-1", 1, GEN).reopenForReplacement(List.of("01-01"));
        var regen = new WorkUnit("regen-01-01", WorkUnitKind.LESSON_REGEN, List.of("01-01"), GEN);

        var second = worker.execute(regen, StageContext.of("R-1", outline, GEN,
                new TimeoutGuard(Duration.ofHours(1), clock), reopened)).payload().entries().get(0);

        assertEquals("courses/c/lessons/rev-1/module-1-lesson-1-why-containers.md", second.storageKey());
        assertEquals(second.text(), store.getText(second.storageKey()).orElseThrow());
        assertEquals(first.text(), store.getText(first.storageKey()).orElseThrow());
        assertNotEquals(first.text(), second.text());
    }

    @Test
    @DisplayName("Prompts carry stage, ref, provider and overrides")
    void promptContents() {
        new ContentStageWorker(gen, store).execute(unit("01-02"), context(Duration.ofHours(1)));

        GenerationPrompt prompt = gen.prompts().get(0);
        assertEquals("content", prompt.constraint(GenerationPrompt.STAGE));
        assertEquals("01-02", prompt.constraint(GenerationPrompt.TARGET_REF));
        assertEquals("openai", prompt.constraint(GenerationPrompt.PROVIDER));
        assertTrue(prompt.prompt().contains("Write Lesson 2: Build Tooling"));
        assertTrue(prompt.prompt().contains("tone: formal"));
        assertTrue(prompt.prompt().contains("COMPLETE COURSE OUTLINE"));
    }

    @Test
    @DisplayName("Yields with the lessons written so far when the budget runs low")
    void yieldsOnBudget() {
        gen.onContent(p -> clock.advance(Duration.ofMinutes(5)));

        var output = new ContentStageWorker(gen, store)
                .execute(unit("01-01", "01-02", "01-03"), context(Duration.ofMinutes(10)));

        assertTrue(output.partial());
        assertEquals(List.of("01-01", "01-02"), output.payload().completedRefs());
        assertEquals(List.of("01-03"), output.payload().remainingRefs());
        assertEquals(2, gen.count("content"));
    }

    @Test
    @DisplayName("A lesson missing from the outline is malformed input")
    void unknownLesson() {
        var worker = new ContentStageWorker(gen, store);

        var e = assertThrows(GenerationServiceException.class,
                () -> worker.execute(unit("07-01"), context(Duration.ofHours(1))));
        assertEquals(ErrorClass.MALFORMED_INPUT, e.errorClass());
    }

    @Test
    @DisplayName("Empty generated text is a transient rejection")
    void emptyText() {
        GenerationService empty = mock(GenerationService.class);
        when(empty.generate(any())).thenReturn(GenerationResponse.ofText("   "));
        var worker = new ContentStageWorker(empty, store);

        var e = assertThrows(GenerationServiceException.class,
                () -> worker.execute(unit("01-01"), context(Duration.ofHours(1))));
        assertEquals(ErrorClass.TRANSIENT_REJECTION, e.errorClass());
    }
}
