package uk.gegc.courseblocks.features.olx.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.courseblocks.BaseUnitTest;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionKey;
import uk.gegc.courseblocks.features.olx.domain.model.UsageKey;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.COURSE;

@DisplayName("CourseScopedIdGenerator Tests")
class CourseScopedIdGeneratorTest extends BaseUnitTest {

    private final CourseScopedIdGenerator generator = new CourseScopedIdGenerator(COURSE);

    @Test
    @DisplayName("createDefinition: url_name becomes the block id")
    void createDefinition_urlName_used() {
        DefinitionKey definition = generator.createDefinition("html", "intro");
        UsageKey usage = generator.createUsage(definition);

        assertThat(usage).isEqualTo(new UsageKey(COURSE, "html", "intro"));
        assertThat(usage.toString()).isEqualTo("block-v1:edX+Demo+2024+type@html+block@intro");
        assertThat(definition.toString()).isEqualTo("def-v1:edX+Demo+2024+type@html+block@intro");
    }

    @Test
    @DisplayName("createDefinition: missing url_name gets a fresh random id")
    void createDefinition_noUrlName_randomHex() {
        DefinitionKey first = generator.createDefinition("html", null);
        DefinitionKey second = generator.createDefinition("html", "");

        assertThat(first.blockId()).matches("[0-9a-f]{32}");
        assertThat(second.blockId()).matches("[0-9a-f]{32}").isNotEqualTo(first.blockId());
    }
}
