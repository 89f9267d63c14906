package com.coursegen.core.assembly;

import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ContentKind;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.stage.workers.VisualTags;
import com.coursegen.core.storage.ArtifactStore;
import com.coursegen.core.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Markdown course book: title page, then every section in outline order.
 * Lesson visual tags are replaced with image links in tag order.
 */
@Component
public class MarkdownBookAssembler implements DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(MarkdownBookAssembler.class);

    static final String SECTION_BREAK = "\n\n---\n\n";

    private final ArtifactStore artifactStore;

    public MarkdownBookAssembler(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    @Override
    public String renderSection(ContentEntry entry, Map<Integer, ImageBinding> images) {
        if (entry.kind() != ContentKind.LESSON) {
            return entry.text();
        }
        List<Integer> ids = entry.imageIds();
        Matcher m = VisualTags.TAG.matcher(entry.text());
        var sb = new StringBuilder();
        int index = 0;
        while (m.find()) {
            ImageBinding binding = index < ids.size() ? images.get(ids.get(index)) : null;
            index++;
            String replacement = binding == null
                    ? m.group()
                    : "![" + binding.description() + "](" + binding.storageKey() + ")";
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String assemble(CourseOutline outline, List<String> sections, String projectFolder) {
        var sb = new StringBuilder();
        sb.append("# ").append(outline.title()).append("\n\n");
        if (!outline.description().isBlank()) {
            sb.append(outline.description()).append("\n\n");
        }
        sb.append(String.join(SECTION_BREAK, sections)).append('\n');

        String key = StorageKeys.book(projectFolder);
        artifactStore.putText(key, sb.toString());
        log.info("Course book assembled at {} ({} sections)", key, sections.size());
        return key;
    }
}
