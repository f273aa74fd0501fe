package uk.gegc.courseblocks.features.poll.application;

import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.application.BlockXmlHandler;
import uk.gegc.courseblocks.features.olx.application.OlxXml;
import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.DefinitionContent;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;
import uk.gegc.courseblocks.features.olx.domain.runtime.ResourceStore;
import uk.gegc.courseblocks.features.poll.domain.model.PollBlock;
import uk.gegc.courseblocks.shared.exception.InvalidDefinitionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OLX handling for {@code <poll_question>}:
 * <pre>{@code
 * <poll_question display_name="Poll">
 *     <p>Which one?</p>
 *     <answer id="yes">Yes</answer>
 *     <answer id="no">No</answer>
 * </poll_question>
 * }</pre>
 * Polls are always exported inline in their parent.
 */
@Component
public class PollBlockHandler implements BlockXmlHandler {

    @Override
    public String category() {
        return PollBlock.CATEGORY;
    }

    @Override
    public BlockSchema schema() {
        return PollBlock.SCHEMA;
    }

    @Override
    public Block newBlock(ScopeIds keys) {
        return new PollBlock(keys);
    }

    @Override
    public DefinitionContent extractContent(Element definitionXml) {
        List<Element> answerElements = definitionXml.elements(PollBlock.ANSWER_TAG);
        if (answerElements.isEmpty()) {
            throw new InvalidDefinitionException("Poll_question definition must include at least one 'answer' tag");
        }

        Element question = OlxXml.copyOf(definitionXml);
        List<Map<String, Object>> answers = new ArrayList<>();
        for (Element answerElement : new ArrayList<>(question.elements(PollBlock.ANSWER_TAG))) {
            String id = answerElement.attributeValue("id");
            if (id != null && !id.isEmpty()) {
                Map<String, Object> answer = new LinkedHashMap<>();
                answer.put("id", id);
                answer.put("text", OlxXml.stringifyChildren(answerElement));
                answers.add(answer);
            }
            question.remove(answerElement);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("answers", answers);
        fields.put("question", OlxXml.stringifyChildren(question));
        return DefinitionContent.of(fields);
    }

    @Override
    public Element definitionToXml(Block block, ResourceStore exportStore) {
        PollBlock poll = (PollBlock) block;
        Element element;
        try {
            element = OlxXml.parse("<" + PollBlock.CATEGORY + ">" + poll.getQuestion() + "</" + PollBlock.CATEGORY + ">");
        } catch (DocumentException e) {
            throw new InvalidDefinitionException("Poll question of " + poll.getUrlName() + " is not well-formed markup", e);
        }
        element.detach();
        element.addAttribute("display_name", poll.getDisplayName());

        for (Map<String, Object> answer : poll.getAnswers()) {
            Element answerElement = element.addElement(PollBlock.ANSWER_TAG);
            answerElement.addAttribute("id", String.valueOf(answer.get("id")));
            answerElement.addText(String.valueOf(answer.get("text")));
        }
        return element;
    }

    @Override
    public boolean exportToFile() {
        return false;
    }
}
