package uk.gegc.courseblocks.features.olx.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.courseblocks.BaseUnitTest;
import uk.gegc.courseblocks.features.html.application.HtmlBlockHandler;
import uk.gegc.courseblocks.features.poll.application.PollBlockHandler;
import uk.gegc.courseblocks.shared.exception.UnsupportedBlockTypeException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BlockHandlerRegistry Tests")
class BlockHandlerRegistryTest extends BaseUnitTest {

    private final BlockHandlerRegistry registry =
            new BlockHandlerRegistry(List.of(new HtmlBlockHandler(), new PollBlockHandler()));

    @Test
    @DisplayName("getHandler: returns the handler registered for the tag")
    void getHandler_knownTag_returnsHandler() {
        assertThat(registry.getHandler("html")).isInstanceOf(HtmlBlockHandler.class);
        assertThat(registry.getHandler("poll_question")).isInstanceOf(PollBlockHandler.class);
        assertThat(registry.categories()).containsExactly("html", "poll_question");
        assertThat(registry.supports("video")).isFalse();
    }

    @Test
    @DisplayName("getHandler: unknown tag is unsupported")
    void getHandler_unknownTag_throws() {
        assertThatThrownBy(() -> registry.getHandler("video"))
                .isInstanceOf(UnsupportedBlockTypeException.class)
                .hasMessageContaining("video");
    }

    @Test
    @DisplayName("getHandler: blank tag is rejected")
    void getHandler_blankTag_throws() {
        assertThatThrownBy(() -> registry.getHandler(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("constructor: two handlers for one tag are rejected")
    void constructor_duplicateCategory_throws() {
        assertThatThrownBy(() -> new BlockHandlerRegistry(List.of(new HtmlBlockHandler(), new HtmlBlockHandler())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("html");
    }
}
