package com.coursegen.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(tempDir);
    }

    @Nested
    @DisplayName("FileSystemArtifactStore")
    class Store {

        @Test
        @DisplayName("put creates parent directories and get reads the bytes back")
        void putAndGet() {
            store.put("courses/a/images/10101.png", new byte[]{7, 8, 9});

            assertTrue(Files.isRegularFile(tempDir.resolve("courses/a/images/10101.png")));
            assertArrayEquals(new byte[]{7, 8, 9}, store.get("courses/a/images/10101.png").orElseThrow());
            assertTrue(store.exists("courses/a/images/10101.png"));
        }

        @Test
        @DisplayName("put overwrites an existing key")
        void overwrite() {
            store.putText("courses/a/book/course-book.md", "v1");
            store.putText("courses/a/book/course-book.md", "v2");

            assertEquals("v2", store.getText("courses/a/book/course-book.md").orElseThrow());
        }

        @Test
        @DisplayName("missing keys are empty")
        void missing() {
            assertTrue(store.get("nope.md").isEmpty());
            assertFalse(store.exists("nope.md"));
        }

        @Test
        @DisplayName("keys may not escape the root")
        void escape() {
            assertThrows(IllegalArgumentException.class, () -> store.put("../outside.md", new byte[0]));
        }
    }

    @Nested
    @DisplayName("StorageKeys")
    class Keys {

        @Test
        @DisplayName("lesson keys use module, lesson and a title slug")
        void lessonKey() {
            assertEquals("courses/a/lessons/module-2-lesson-3-rest-apis-in-practice.md",
                    StorageKeys.lesson("courses/a", 0, 2, 3, "REST APIs: in Practice!"));
        }

        @Test
        @DisplayName("slugs strip accents and fall back to untitled")
        void slug() {
            assertEquals("cafe-creme", StorageKeys.slug("Café  Crème"));
            assertEquals("untitled", StorageKeys.slug("  "));
            assertEquals("untitled", StorageKeys.slug("!!!"));
        }

        @Test
        @DisplayName("image keys are revisioned after the first pass")
        void imageKeys() {
            assertEquals("courses/a/images/10101.png", StorageKeys.image("courses/a", 0, 10101));
            assertEquals("courses/a/images/rev-2/10101.png", StorageKeys.image("courses/a", 2, 10101));
        }

        @Test
        @DisplayName("lesson and lab keys are revisioned after the first pass")
        void textKeysRevisioned() {
            assertEquals("courses/a/lessons/rev-1/module-2-lesson-3-intro.md",
                    StorageKeys.lesson("courses/a", 1, 2, 3, "Intro"));
            assertEquals("courses/a/labguide/rev-3/lab-01-00-01.md", StorageKeys.labGuide("courses/a", 3, "01-00-01"));
            assertEquals("courses/a/labguide/plans/rev-3/lab-01-00-01-plan.md",
                    StorageKeys.labPlan("courses/a", 3, "01-00-01"));
        }

        @Test
        @DisplayName("lab, book and run-state keys")
        void otherKeys() {
            assertEquals("courses/a/labguide/lab-01-00-01.md", StorageKeys.labGuide("courses/a", 0, "01-00-01"));
            assertEquals("courses/a/labguide/plans/lab-01-00-01-plan.md", StorageKeys.labPlan("courses/a", 0, "01-00-01"));
            assertEquals("courses/a/book/course-book.md", StorageKeys.book("courses/a"));
            assertEquals("runs/CGEN-1/run-state.json", StorageKeys.runState("CGEN-1"));
        }
    }
}
