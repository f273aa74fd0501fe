package uk.gegc.courseblocks.features.olx.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Freezes the bound {@link OlxProperties} into the {@link OlxSettings} shared by the import and export
 * components.
 */
@Configuration
@Slf4j
public class OlxConfig {

    @Bean
    public OlxSettings olxSettings(OlxProperties properties) {
        Map<String, Set<String>> notToClean = new LinkedHashMap<>();
        properties.getMetadataNotToClean().forEach((category, fields) -> notToClean.put(category, Set.copyOf(fields)));

        OlxSettings settings = new OlxSettings(
                Set.copyOf(properties.getMetadataToStrip()),
                Set.copyOf(properties.getMetadataToExportToPolicy()),
                notToClean,
                properties.getFilenameExtension().trim()
        );
        log.info("OLX settings: {} stripped attributes, {} policy-only settings, definition files *.{}",
                settings.metadataToStrip().size(), settings.metadataToExportToPolicy().size(),
                settings.filenameExtension());
        return settings;
    }
}
