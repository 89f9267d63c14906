package com.coursegen.core.persistence;

import com.coursegen.core.model.CompletionStatus;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.model.RunScope;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.WorkUnit;
import com.coursegen.core.model.WorkUnitKind;
import com.coursegen.core.storage.FileSystemArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactRunStateStoreTest {

    private static final GenerationContext CONTEXT =
            new GenerationContext("outlines/course.yaml", "courses/c", "openai", Map.of("tone", "friendly"));

    @TempDir
    Path tempDir;

    private ArtifactRunStateStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactRunStateStore(new FileSystemArtifactStore(tempDir));
    }

    private static RunState populated() {
        var entry = new ContentEntry("01-01", ContentKind.LESSON, "Why Containers",
                "courses/c/lessons/module-1-lesson-1-why-containers.md", "# Why\n\n[VISUAL: a]", List.of(10101));
        var origin = new WorkUnit("m01-lessons-1", WorkUnitKind.LESSON_BATCH, List.of("01-01", "01-02", "01-03"),
                CONTEXT);
        var continuation = origin.continuation(List.of("01-02", "01-03"));
        return new RunState("CGEN-2026-0003", RunScope.FULL, 0, 3, List.of(),
                Map.of("01-01", entry),
                Map.of(10101, new ImageBinding("courses/c/images/10101.png", "a")),
                CompletionStatus.PARTIAL, List.of(), List.of(continuation), CONTEXT);
    }

    @Test
    @DisplayName("Saved state is written as JSON under runs/{id}")
    void writesJson() throws Exception {
        store.save(populated());

        Path file = tempDir.resolve("runs/CGEN-2026-0003/run-state.json");
        assertTrue(Files.isRegularFile(file));
        String json = Files.readString(file);
        assertTrue(json.contains("\"runId\" : \"CGEN-2026-0003\""));
        assertFalse(json.contains("complete\""), "derived flags are not persisted");
    }

    @Test
    @DisplayName("Round trip keeps content, image bindings and pending continuations")
    void roundTrip() {
        RunState original = populated();
        store.save(original);

        RunState loaded = store.find("CGEN-2026-0003").orElseThrow();

        assertEquals(original, loaded);
        WorkUnit pending = loaded.pendingUnits().get(0);
        assertEquals("m01-lessons-1~2", pending.unitId());
        assertEquals("m01-lessons-1", pending.originUnitId());
        assertTrue(pending.isContinuation());
        assertEquals(new ImageBinding("courses/c/images/10101.png", "a"), loaded.imageBindings().get(10101));
    }

    @Test
    @DisplayName("Saving again overwrites the previous state")
    void overwrite() {
        RunState first = populated();
        store.save(first);
        store.save(first.reopenForReplacement(List.of("01-01")));

        RunState loaded = store.find("CGEN-2026-0003").orElseThrow();
        assertEquals(1, loaded.revision());
        assertEquals(RunScope.NARROW, loaded.scope());
        assertEquals(List.of("01-01"), loaded.replacementTargets());
    }

    @Test
    @DisplayName("Unknown runs are absent")
    void unknownRun() {
        assertTrue(store.find("CGEN-404").isEmpty());
        assertFalse(store.exists("CGEN-404"));
    }
}
