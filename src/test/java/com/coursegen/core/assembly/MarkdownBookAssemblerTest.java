package com.coursegen.core.assembly;

import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.outline.OutlineParser;
import com.coursegen.core.outline.Outlines;
import com.coursegen.core.storage.FileSystemArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownBookAssemblerTest {

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore store;
    private MarkdownBookAssembler assembler;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(tempDir);
        assembler = new MarkdownBookAssembler(store);
    }

    private static ContentEntry lesson(String text, List<Integer> imageIds) {
        return new ContentEntry("01-01", ContentKind.LESSON, "First", "k", text, imageIds);
    }

    @Test
    @DisplayName("Visual tags become image links in tag order")
    void replacesTags() {
        var entry = lesson("Intro\n[VISUAL: a map]\nMiddle\n[VISUAL: a chart]\n", List.of(10101, 10102));
        var images = Map.of(
                10101, new ImageBinding("courses/b/images/10101.png", "a map"),
                10102, new ImageBinding("courses/b/images/10102.png", "a chart"));

        String section = assembler.renderSection(entry, images);

        assertEquals("Intro\n![a map](courses/b/images/10101.png)\nMiddle\n"
                + "![a chart](courses/b/images/10102.png)\n", section);
    }

    @Test
    @DisplayName("Tags without a bound image are left in place")
    void unboundTag() {
        var entry = lesson("[VISUAL: one]\n[VISUAL: two]", List.of(10101));
        var images = Map.of(10101, new ImageBinding("img/10101.png", "one"));

        assertEquals("![one](img/10101.png)\n[VISUAL: two]", assembler.renderSection(entry, images));
    }

    @Test
    @DisplayName("Lab sections are rendered verbatim")
    void labVerbatim() {
        var lab = new ContentEntry("01-00-01", ContentKind.LAB, "Lab", "k", "# Lab [VISUAL: x]", List.of());
        assertEquals("# Lab [VISUAL: x]", assembler.renderSection(lab, Map.of()));
    }

    @Test
    @DisplayName("The book starts with the course title and joins sections with breaks")
    void assemble() {
        var outline = new OutlineParser(store).parse(Outlines.SEVEN_LESSONS);

        String key = assembler.assemble(outline, List.of("# One", "# Two"), "courses/b");

        assertEquals("courses/b/book/course-book.md", key);
        assertEquals("# Cloud Native Java\n\nBuilding services on the JVM\n\n# One\n\n---\n\n# Two\n",
                store.getText(key).orElseThrow());
    }
}
