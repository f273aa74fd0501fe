package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable per-deployment OLX conventions, built once at startup.
 *
 * @param metadataToStrip          attributes never loaded into fields nor re-emitted
 * @param metadataToExportToPolicy settings that belong to the course policy file instead of inline XML
 * @param metadataNotToClean       per-category settings kept verbatim on the exported element
 * @param filenameExtension        extension of definition files referenced by pointer tags
 */
public record OlxSettings(
        Set<String> metadataToStrip,
        Set<String> metadataToExportToPolicy,
        Map<String, Set<String>> metadataNotToClean,
        String filenameExtension
) {

    public static final List<String> DEFAULT_METADATA_TO_STRIP = List.of(
            "data_dir",
            "tabs",
            "grading_policy",
            "discussion_blackouts",
            "course",
            "org",
            "url_name",
            "filename",
            "xml_attributes",
            "x-is-pointer-node"
    );

    public OlxSettings {
        metadataToStrip = metadataToStrip == null ? Set.of() : Set.copyOf(metadataToStrip);
        metadataToExportToPolicy = metadataToExportToPolicy == null ? Set.of() : Set.copyOf(metadataToExportToPolicy);
        metadataNotToClean = metadataNotToClean == null ? Map.of() : metadataNotToClean.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> Set.copyOf(entry.getValue())));
        if (filenameExtension == null || filenameExtension.isBlank()) {
            filenameExtension = "xml";
        }
    }

    public static OlxSettings defaults() {
        return new OlxSettings(
                Set.copyOf(DEFAULT_METADATA_TO_STRIP),
                Set.of("discussion_topics"),
                Map.of("video", Set.of("sub", "transcripts")),
                "xml"
        );
    }

    public Set<String> notToCleanFor(String category) {
        return metadataNotToClean.getOrDefault(category, Set.of());
    }
}
