package uk.gegc.courseblocks.features.poll.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.courseblocks.BaseUnitTest;
import uk.gegc.courseblocks.features.poll.domain.model.PollBlock;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.courseblocks.testsupport.OlxTestFixtures.keys;

@DisplayName("PollStateService Tests")
class PollStateServiceTest extends BaseUnitTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PollStateService service;
    private PollBlock poll;

    @BeforeEach
    void setUp() {
        service = new PollStateService(objectMapper);
        poll = new PollBlock(keys("poll_question", "fruit"));
        poll.setQuestion("<p>Favourite?</p>");
        poll.setAnswers(List.of(
                Map.of("id", "apple", "text", "Apple"),
                Map.of("id", "pear", "text", "Pear")));
    }

    @Test
    @DisplayName("dumpPoll: initializes tallies and hides the total before voting")
    void dumpPoll_beforeVoting() throws Exception {
        JsonNode dump = objectMapper.readTree(service.dumpPoll(poll));

        assertThat(dump.get("answers").get("apple").asText()).isEqualTo("Apple");
        assertThat(dump.get("question").asText()).isEqualTo("<p>Favourite?</p>");
        assertThat(dump.get("poll_answers").get("pear").asInt()).isZero();
        assertThat(dump.get("total").asInt()).isZero();
        assertThat(dump.get("reset").asText()).isEqualTo("true");
        assertThat(poll.getPollAnswers()).containsEntry("apple", 0).containsEntry("pear", 0);
    }

    @Test
    @DisplayName("dumpPoll: reset flag comes from xml_attributes")
    void dumpPoll_resetFromXmlAttributes() throws Exception {
        poll.setXmlAttributes(Map.of("reset", "False"));

        JsonNode dump = objectMapper.readTree(service.dumpPoll(poll));

        assertThat(dump.get("reset").asText()).isEqualTo("false");
    }

    @Test
    @DisplayName("submitAnswer: counts a first vote and records it")
    void submitAnswer_firstVote_counted() {
        service.dumpPoll(poll);

        Map<String, Object> result = service.submitAnswer(poll, "apple");

        assertThat(result).containsEntry("total", 1L).containsKey("callback");
        assertThat(poll.isVoted()).isTrue();
        assertThat(poll.getPollAnswer()).isEqualTo("apple");
        assertThat(poll.getPollAnswers()).containsEntry("apple", 1L);
    }

    @Test
    @DisplayName("submitAnswer: second vote and unknown answers are refused")
    void submitAnswer_repeatOrUnknown_refused() {
        service.dumpPoll(poll);
        service.submitAnswer(poll, "apple");

        assertThat(service.submitAnswer(poll, "pear")).containsEntry("error", "Unknown Command!");
        assertThat(service.submitAnswer(poll, "")).containsEntry("error", "No answer provided!");
        assertThat(poll.getPollAnswers()).containsEntry("pear", 0);
    }

    @Test
    @DisplayName("resetState: withdraws the vote")
    void resetState_afterVote_withdrawn() {
        service.dumpPoll(poll);
        service.submitAnswer(poll, "pear");

        Map<String, Object> result = service.resetState(poll);

        assertThat(result).containsEntry("status", "success");
        assertThat(poll.isVoted()).isFalse();
        assertThat(poll.getPollAnswer()).isEmpty();
        assertThat(poll.getPollAnswers()).containsEntry("pear", 0L);
        assertThat(service.getState(poll)).containsEntry("total", 0L);
    }

    @Test
    @DisplayName("getState: totals all votes")
    void getState_totalsVotes() {
        poll.setPollAnswers(Map.of("apple", 3, "pear", 2));

        Map<String, Object> state = service.getState(poll);

        assertThat(state).containsEntry("total", 5L).containsEntry("poll_answer", "");
    }

    @Test
    @DisplayName("tally changes do not leak through previously read maps")
    void pollAnswers_copyOnRead() {
        service.dumpPoll(poll);
        Map<String, Object> before = poll.getPollAnswers();

        service.submitAnswer(poll, "apple");

        assertThat(before).containsEntry("apple", 0);
    }
}
