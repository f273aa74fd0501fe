package uk.gegc.courseblocks.features.poll.application;

import org.dom4j.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.courseblocks.BaseUnitTest;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionContent;
import uk.gegc.courseblocks.features.poll.domain.model.PollBlock;
import uk.gegc.courseblocks.shared.exception.InvalidDefinitionException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.keys;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.xml;

@DisplayName("PollBlockHandler Tests")
class PollBlockHandlerTest extends BaseUnitTest {

    private final PollBlockHandler handler = new PollBlockHandler();

    @Test
    @DisplayName("extractContent: answers with ids in order, question is the remaining markup")
    void extractContent_answersAndQuestion() {
        Element node = xml("""
                <poll_question>
                    <h3>Age</h3>
                    <answer id="young">Under 30</answer>
                    <p>Pick one</p>
                    <answer id="old">30 <b>or</b> over</answer>
                </poll_question>
                """);

        DefinitionContent content = handler.extractContent(node);

        assertThat(content.fields().get("answers")).isEqualTo(List.of(
                Map.of("id", "young", "text", "Under 30"),
                Map.of("id", "old", "text", "30 <b>or</b> over")));
        assertThat(content.fields()).containsEntry("question", "<h3>Age</h3><p>Pick one</p>");
        assertThat(content.children()).isEmpty();
        assertThat(node.elements("answer")).hasSize(2);
    }

    @Test
    @DisplayName("extractContent: answers without id are dropped")
    void extractContent_answerWithoutId_dropped() {
        DefinitionContent content = handler.extractContent(
                xml("<poll_question><answer>Orphan</answer><answer id=\"\">Blank</answer><answer id=\"a\">A</answer></poll_question>"));

        assertThat(content.fields().get("answers")).isEqualTo(List.of(Map.of("id", "a", "text", "A")));
        assertThat(content.fields()).containsEntry("question", "");
    }

    @Test
    @DisplayName("extractContent: a poll needs at least one answer")
    void extractContent_noAnswers_throws() {
        assertThatThrownBy(() -> handler.extractContent(xml("<poll_question><p>Q</p></poll_question>")))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("at least one 'answer' tag");
    }

    @Test
    @DisplayName("definitionToXml: question markup plus escaped answers")
    void definitionToXml_buildsPoll() {
        PollBlock block = new PollBlock(keys("poll_question", "p1"));
        block.setDisplayName("Age poll");
        block.setQuestion("<h3>Age</h3>");
        block.setAnswers(List.of(Map.of("id", "young", "text", "Under <30>")));

        Element element = handler.definitionToXml(block, null);

        assertThat(element.getName()).isEqualTo("poll_question");
        assertThat(element.attributeValue("display_name")).isEqualTo("Age poll");
        assertThat(element.element("h3").getText()).isEqualTo("Age");
        assertThat(element.element("answer").attributeValue("id")).isEqualTo("young");
        assertThat(element.element("answer").getText()).isEqualTo("Under <30>");
    }

    @Test
    @DisplayName("definitionToXml: malformed question markup is an invalid definition")
    void definitionToXml_malformedQuestion_throws() {
        PollBlock block = new PollBlock(keys("poll_question", "p1"));
        block.setQuestion("<p>unclosed");

        assertThatThrownBy(() -> handler.definitionToXml(block, null))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("p1");
    }

    @Test
    @DisplayName("polls are exported inline")
    void exportToFile_false() {
        assertThat(handler.exportToFile()).isFalse();
        assertThat(handler.rawContentExtension()).isEmpty();
    }
}
