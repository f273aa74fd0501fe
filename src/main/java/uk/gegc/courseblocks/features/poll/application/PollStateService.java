package uk.gegc.courseblocks.features.poll.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.courseblocks.features.poll.domain.model.PollBlock;
import uk.gegc.courseblocks.shared.exception.FieldSerializationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Learner-facing poll operations. Every change to the vote tally is made on a copy which is then assigned
 * back to the block.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollStateService {

    private final ObjectMapper objectMapper;

    /**
     * Initializes missing tallies to zero and returns the poll as a JSON document for the client.
     */
    public String dumpPoll(PollBlock poll) {
        Map<String, Object> pollAnswers = poll.getPollAnswers();
        Map<String, Object> answersToJson = new LinkedHashMap<>();
        for (Map<String, Object> answer : poll.getAnswers()) {
            String id = String.valueOf(answer.get("id"));
            pollAnswers.putIfAbsent(id, 0);
            answersToJson.put(id, answer.get("text"));
        }
        poll.setPollAnswers(pollAnswers);

        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("answers", answersToJson);
        dump.put("question", poll.getQuestion());
        dump.put("poll_answer", poll.getPollAnswer());
        dump.put("poll_answers", pollAnswers);
        dump.put("total", poll.isVoted() ? total(pollAnswers) : 0);
        dump.put("reset", String.valueOf(poll.getXmlAttributes().getOrDefault("reset", "true")).toLowerCase());
        try {
            return objectMapper.writeValueAsString(dump);
        } catch (JsonProcessingException e) {
            throw new FieldSerializationException("Failed to serialize poll " + poll.getUrlName(), e);
        }
    }

    public Map<String, Object> getState(PollBlock poll) {
        Map<String, Object> pollAnswers = poll.getPollAnswers();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("poll_answer", poll.getPollAnswer());
        state.put("poll_answers", pollAnswers);
        state.put("total", total(pollAnswers));
        return state;
    }

    /**
     * Records a vote for {@code answer} unless the learner already voted or the answer is unknown.
     */
    public Map<String, Object> submitAnswer(PollBlock poll, String answer) {
        if (answer == null || answer.isEmpty()) {
            return Map.of("error", "No answer provided!");
        }
        Map<String, Object> pollAnswers = poll.getPollAnswers();
        if (!pollAnswers.containsKey(answer) || poll.isVoted()) {
            log.debug("Rejected vote {} on poll {}", answer, poll.getUrlName());
            return Map.of("error", "Unknown Command!");
        }

        pollAnswers.put(answer, count(pollAnswers.get(answer)) + 1);
        poll.setPollAnswers(pollAnswers);
        poll.setVoted(true);
        poll.setPollAnswer(answer);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("poll_answers", pollAnswers);
        result.put("total", total(pollAnswers));
        result.put("callback", Map.of("objectName", "Conditional"));
        return result;
    }

    /**
     * Withdraws the learner's vote so they can answer again.
     */
    public Map<String, Object> resetState(PollBlock poll) {
        poll.setVoted(false);
        Map<String, Object> pollAnswers = poll.getPollAnswers();
        String previous = poll.getPollAnswer();
        if (pollAnswers.containsKey(previous)) {
            pollAnswers.put(previous, count(pollAnswers.get(previous)) - 1);
            poll.setPollAnswers(pollAnswers);
        }
        poll.setPollAnswer("");
        return Map.of("status", "success");
    }

    private static long total(Map<String, Object> pollAnswers) {
        return pollAnswers.values().stream().mapToLong(PollStateService::count).sum();
    }

    private static long count(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
