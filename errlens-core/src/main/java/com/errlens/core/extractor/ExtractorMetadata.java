package com.errlens.core.extractor;

import java.util.List;

/**
 * Static descriptive metadata of an extractor.
 *
 * @param name unique kebab-case identifier
 * @param version extractor version
 * @param author author or organization
 * @param description one-line description
 * @param tags free-form tags (e.g., "testing", "javascript")
 */
public record ExtractorMetadata(
    String name,
    String version,
    String author,
    String description,
    List<String> tags
) {
    public ExtractorMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
