package uk.gegc.courseblocks.features.olx.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dom4j.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.courseblocks.BaseUnitTest;
import uk.gegc.courseblocks.features.html.application.HtmlBlockHandler;
import uk.gegc.courseblocks.features.html.domain.model.HtmlBlock;
import uk.gegc.courseblocks.features.olx.application.BlockExporter;
import uk.gegc.courseblocks.features.olx.application.BlockHandlerRegistry;
import uk.gegc.courseblocks.features.olx.application.BlockMaterializer;
import uk.gegc.courseblocks.features.olx.application.DefinitionLoader;
import uk.gegc.courseblocks.features.olx.application.FieldCodec;
import uk.gegc.courseblocks.features.olx.application.MetadataMerger;
import uk.gegc.courseblocks.features.olx.application.OlxExportService;
import uk.gegc.courseblocks.features.olx.application.OlxImportService;
import uk.gegc.courseblocks.features.olx.application.PointerTags;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.FieldDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.OlxSettings;
import uk.gegc.courseblocks.features.olx.domain.runtime.Aside;
import uk.gegc.courseblocks.features.olx.domain.runtime.PolicySource;
import uk.gegc.courseblocks.features.olx.infra.CourseScopedIdGenerator;
import uk.gegc.courseblocks.features.olx.infra.DefaultBlockRuntime;
import uk.gegc.courseblocks.features.olx.infra.FileSystemResourceStore;
import uk.gegc.courseblocks.features.olx.infra.JsonPolicySource;
import uk.gegc.courseblocks.features.poll.application.PollBlockHandler;
import uk.gegc.courseblocks.features.poll.domain.model.PollBlock;
import uk.gegc.courseblocks.shared.exception.InvalidDefinitionException;
import uk.gegc.courseblocks.shared.exception.UnsupportedBlockTypeException;
import uk.gegc.courseblocks.testsupport.OlxTestFixtures;
import uk.gegc.courseblocks.testsupport.RecordingAside;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.COURSE;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.runtime;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.xml;

@DisplayName("OLX import/export round trip Tests")
class OlxRoundTripTest extends BaseUnitTest {

    @TempDir
    Path courseDir;

    private FileSystemResourceStore store;
    private OlxImportService importService;
    private OlxExportService exportService;

    @BeforeEach
    void setUp() {
        OlxSettings settings = OlxSettings.defaults();
        FieldCodec codec = OlxTestFixtures.codec();
        BlockHandlerRegistry registry = new BlockHandlerRegistry(List.of(new HtmlBlockHandler(), new PollBlockHandler()));
        importService = new OlxImportServiceImpl(registry, new DefinitionLoader(settings),
                new MetadataMerger(codec, settings), new BlockMaterializer());
        exportService = new OlxExportServiceImpl(registry, new BlockExporter(codec, settings));
        store = new FileSystemResourceStore(courseDir);
    }

    @Test
    @DisplayName("html: exported pointer re-imports with the same declared field values")
    void html_exportThenImport_sameFieldValues() {
        // Given
        HtmlBlock original = (HtmlBlock) importService.importBlock(xml(
                "<html url_name=\"intro\" display_name=\"Welcome\" editor=\"raw\" use_latex_compiler=\"true\">"
                        + "<p>Hello <b>world</b></p></html>"), runtime(store));

        // When
        Element pointer = exportService.exportBlock(original, runtime(store));
        HtmlBlock reimported = (HtmlBlock) importService.importBlock(pointer, runtime(store));

        // Then
        assertThat(PointerTags.isPointer(pointer)).isTrue();
        assertThat(reimported.getUrlName()).isEqualTo("intro");
        assertDeclaredFieldsEqual(original, reimported);
        assertThat(reimported.getData()).isEqualTo("<p>Hello <b>world</b></p>");
        assertThat(reimported.getEditor()).isEqualTo("raw");
        assertThat(reimported.isUseLatexCompiler()).isTrue();
        assertThat(reimported.getXmlAttributes().get("filename"))
                .isEqualTo(List.of("html/intro.xml", "html/intro.xml"));
    }

    @Test
    @DisplayName("html: asides survive export to a side file and re-import")
    void html_withAside_exportThenImport_asideKept() {
        // Given
        DefaultBlockRuntime withAsides = runtime(store, List.of(RecordingAside.of("tagging_aside")));
        HtmlBlock original = (HtmlBlock) importService.importBlock(xml(
                "<html url_name=\"intro\"><p>x</p><tagging_aside xblock-family=\"xblock_asides.v1\"/></html>"),
                withAsides);

        // When
        Element pointer = exportService.exportBlock(original, withAsides);
        HtmlBlock reimported = (HtmlBlock) importService.importBlock(pointer, withAsides);

        // Then
        assertThat(original.getAsides()).hasSize(1);
        assertThat(original.getData()).isEqualTo("<p>x</p>");
        assertThat(reimported.getAsides()).extracting(Aside::blockType).containsExactly("tagging_aside");
        assertThat(reimported.getData()).isEqualTo("<p>x</p>");
    }

    @Test
    @DisplayName("poll: inline export re-imports with the same declared field values")
    void poll_exportThenImport_sameFieldValues() {
        PollBlock original = (PollBlock) importService.importBlock("""
                <poll_question url_name="fav" display_name="Favourite fruit">
                    <h3>Which fruit?</h3>
                    <answer id="apple">Apples &amp; pears</answer>
                    <answer>No id, dropped</answer>
                    <answer id="plum"><i>Plums</i></answer>
                </poll_question>
                """, runtime(store));

        Element exported = exportService.exportBlock(original, runtime(store));
        PollBlock reimported = (PollBlock) importService.importBlock(exported, runtime(store));

        assertThat(original.getAnswers()).containsExactly(
                Map.of("id", "apple", "text", "Apples & pears"),
                Map.of("id", "plum", "text", "<i>Plums</i>"));
        assertDeclaredFieldsEqual(original, reimported);
    }

    @Test
    @DisplayName("unknown attribute survives import and export unchanged")
    void unknownAttribute_importExport_preserved() {
        PollBlock block = (PollBlock) importService.importBlock(xml(
                "<poll_question url_name=\"p1\" foo=\"bar\" weird=\"{&quot;a&quot;: 1}\">"
                        + "<answer id=\"y\">Yes</answer></poll_question>"), runtime(store));

        Element exported = exportService.exportBlock(block, runtime(store));

        assertThat(block.getXmlAttributes()).containsEntry("foo", "bar");
        assertThat(exported.attributeValue("foo")).isEqualTo("bar");
        assertThat(exported.attributeValue("weird")).isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("policy.json overrides inline and embedded metadata")
    void policy_overridesInlineAndEmbedded() {
        OlxTestFixtures.writeFile(store, "policy.json", """
                {"poll_question/p1": {"display_name": "From policy", "discussion_topics": {"General": 1}}}
                """);
        DefaultBlockRuntime withPolicy = DefaultBlockRuntime.builder()
                .idGenerator(new CourseScopedIdGenerator(COURSE))
                .resources(store)
                .policySource(JsonPolicySource.load(store, JsonPolicySource.DEFAULT_POLICY_PATH,
                        new ObjectMapper()))
                .build();

        PollBlock block = (PollBlock) importService.importBlock(xml("""
                <poll_question url_name="p1" display_name="Inline">
                    <meta>{"display_name": "Embedded"}</meta>
                    <answer id="y">Yes</answer>
                </poll_question>
                """), withPolicy);

        assertThat(block.getDisplayName()).isEqualTo("From policy");
        assertThat(block.getXmlAttributes()).containsEntry("discussion_topics", Map.of("General", 1));
    }

    @Test
    @DisplayName("importBlock: node without url_name gets a generated id")
    void importBlock_noUrlName_generatedId() {
        Block block = importService.importBlock("<html><p>Anonymous</p></html>", runtime(store));

        assertThat(block.getUrlName()).matches("[0-9a-f]{32}");
        assertThat(block.getLocation().courseKey()).isEqualTo(COURSE);
    }

    @Test
    @DisplayName("importBlock: unknown tag is unsupported")
    void importBlock_unknownTag_throws() {
        assertThatThrownBy(() -> importService.importBlock("<video url_name=\"v1\"/>", runtime(store)))
                .isInstanceOf(UnsupportedBlockTypeException.class);
    }

    @Test
    @DisplayName("importBlock: malformed XML text is an invalid definition")
    void importBlock_malformedXml_throws() {
        assertThatThrownBy(() -> importService.importBlock("<html><p></html>", runtime(store)))
                .isInstanceOf(InvalidDefinitionException.class);
    }

    @Test
    @DisplayName("importBlock: poll without answers is rejected")
    void importBlock_pollWithoutAnswers_throws() {
        assertThatThrownBy(() -> importService.importBlock(
                "<poll_question url_name=\"p1\"><p>Q?</p></poll_question>", runtime(store)))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("answer");
    }

    @Test
    @DisplayName("exportToString: renders the exported node")
    void exportToString_poll_rendersInline() {
        Block block = importService.importBlock(
                "<poll_question url_name=\"p1\" display_name=\"P\"><answer id=\"y\">Yes</answer></poll_question>",
                runtime(store));

        String rendered = exportService.exportToString(block, runtime(store));

        assertThat(rendered)
                .startsWith("<poll_question")
                .contains("<answer id=\"y\">Yes</answer>")
                .contains("url_name=\"p1\"");
    }

    @Test
    @DisplayName("importBlock: policy source defaults to empty")
    void importBlock_defaultRuntime_noPolicy() {
        DefaultBlockRuntime bare = DefaultBlockRuntime.builder()
                .idGenerator(new CourseScopedIdGenerator(COURSE))
                .resources(store)
                .build();

        Block block = importService.importBlock("<html url_name=\"a\" display_name=\"A\">x</html>", bare);

        assertThat(block.getDisplayName()).isEqualTo("A");
        assertThat(PolicySource.empty().getPolicy(block.getLocation())).isEmpty();
    }

    private static void assertDeclaredFieldsEqual(Block expected, Block actual) {
        for (FieldDefinition field : expected.getSchema().fields()) {
            if (BlockSchema.XML_ATTRIBUTES.equals(field.name())) {
                continue;
            }
            assertThat(actual.getField(field.name()))
                    .as("field %s", field.name())
                    .isEqualTo(expected.getField(field.name()));
        }
    }
}
