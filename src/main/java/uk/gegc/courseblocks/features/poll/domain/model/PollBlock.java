package uk.gegc.courseblocks.features.poll.domain.model;

import uk.gegc.courseblocks.features.olx.domain.model.Block;
import uk.gegc.courseblocks.features.olx.domain.model.BlockSchema;
import uk.gegc.courseblocks.features.olx.domain.model.FieldDefinition;
import uk.gegc.courseblocks.features.olx.domain.model.FieldScope;
import uk.gegc.courseblocks.features.olx.domain.model.FieldType;
import uk.gegc.courseblocks.features.olx.domain.model.ScopeIds;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-question poll. Answers and the question markup are definition content; votes are per-learner
 * state plus a course-wide tally in {@code poll_answers}.
 */
public class PollBlock extends Block {

    public static final String CATEGORY = "poll_question";
    public static final String ANSWER_TAG = "answer";

    public static final BlockSchema SCHEMA = BlockSchema.of(
            FieldDefinition.of("display_name", FieldScope.SETTINGS, FieldType.STRING, "poll_question"),
            FieldDefinition.of("voted", FieldScope.USER_STATE, FieldType.BOOLEAN, false),
            FieldDefinition.of("poll_answer", FieldScope.USER_STATE, FieldType.STRING, ""),
            FieldDefinition.of("poll_answers", FieldScope.USER_STATE_SUMMARY, FieldType.DICT, Map.of()),
            FieldDefinition.of("answers", FieldScope.CONTENT, FieldType.LIST, List.of()),
            FieldDefinition.of("question", FieldScope.CONTENT, FieldType.STRING, ""),
            FieldDefinition.of(BlockSchema.XML_ATTRIBUTES, FieldScope.SETTINGS, FieldType.DICT, Map.of())
    );

    public PollBlock(ScopeIds scopeIds) {
        super(scopeIds, SCHEMA);
    }

    public boolean isVoted() {
        return Boolean.TRUE.equals(getField("voted"));
    }

    public void setVoted(boolean voted) {
        setField("voted", voted);
    }

    public String getPollAnswer() {
        return (String) getField("poll_answer");
    }

    public void setPollAnswer(String pollAnswer) {
        setField("poll_answer", pollAnswer);
    }

    /**
     * Vote counts by answer id. The returned map is a copy; write changes back with
     * {@link #setPollAnswers(Map)}.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getPollAnswers() {
        Object value = getField("poll_answers");
        return value == null ? new LinkedHashMap<>() : (Map<String, Object>) value;
    }

    public void setPollAnswers(Map<String, Object> pollAnswers) {
        setField("poll_answers", pollAnswers);
    }

    /**
     * Answers in document order, each a map with {@code id} and {@code text}.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getAnswers() {
        Object value = getField("answers");
        return value == null ? List.of() : (List<Map<String, Object>>) value;
    }

    public void setAnswers(List<Map<String, Object>> answers) {
        setField("answers", answers);
    }

    public String getQuestion() {
        return (String) getField("question");
    }

    public void setQuestion(String question) {
        setField("question", question);
    }
}
