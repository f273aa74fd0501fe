package uk.gegc.courseblocks.features.olx.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "olx")
public class OlxProperties {

    /**
     * Attributes that are never loaded into block fields nor written back to XML.
     */
    @NotNull(message = "Property olx.metadata-to-strip must be configured")
    private List<String> metadataToStrip = new ArrayList<>(OlxSettings.DEFAULT_METADATA_TO_STRIP);

    /**
     * Settings exported to the course policy file instead of the block's XML.
     */
    @NotNull(message = "Property olx.metadata-to-export-to-policy must be configured")
    private List<String> metadataToExportToPolicy = new ArrayList<>(List.of("discussion_topics"));

    /**
     * Per block category, settings left on the exported element by attribute cleaning.
     */
    @NotNull(message = "Property olx.metadata-not-to-clean must be configured")
    private Map<String, List<String>> metadataNotToClean = new HashMap<>(Map.of("video", List.of("sub", "transcripts")));

    @NotBlank(message = "olx.filename-extension must not be blank")
    private String filenameExtension = "xml";
}
