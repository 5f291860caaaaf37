package me.golemcore.agent.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.TodoItem;
import me.golemcore.agent.domain.model.TodoStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldRecognizeUpdatePlanTool() {
        assertTrue(PlanExtractor.isPlanTool("update_plan"));
        assertFalse(PlanExtractor.isPlanTool("shell"));
        assertFalse(PlanExtractor.isPlanTool(null));
    }

    @Test
    void shouldParseStepsAndStatuses() throws Exception {
        JsonNode arguments = mapper.readTree("""
                {"plan": [
                  {"step": "Read code", "status": "completed"},
                  {"step": "Write fix", "status": "in_progress"},
                  {"step": "Run tests", "status": "pending"},
                  {"step": "Deploy", "status": "blocked"}
                ]}
                """);

        Optional<List<TodoItem>> todos = PlanExtractor.fromArguments(arguments);

        assertEquals(List.of(
                new TodoItem("Read code", TodoStatus.COMPLETED),
                new TodoItem("Write fix", TodoStatus.IN_PROGRESS),
                new TodoItem("Run tests", TodoStatus.PENDING),
                new TodoItem("Deploy", TodoStatus.BLOCKED)), todos.orElseThrow());
    }

    @Test
    void shouldMapUnknownStatusToPending() throws Exception {
        JsonNode arguments = mapper.readTree("{\"plan\": [{\"step\": \"Think\", \"status\": \"someday\"}]}");

        assertEquals(List.of(new TodoItem("Think", TodoStatus.PENDING)),
                PlanExtractor.fromArguments(arguments).orElseThrow());
    }

    @Test
    void shouldSkipItemsWithoutTextualStepOrStatus() throws Exception {
        JsonNode arguments = mapper.readTree("""
                {"plan": [
                  {"step": "Kept", "status": "pending"},
                  {"status": "pending"},
                  {"step": "No status"},
                  {"step": 42, "status": "pending"},
                  {"step": "Numeric status", "status": 1}
                ]}
                """);

        assertEquals(List.of(new TodoItem("Kept", TodoStatus.PENDING)),
                PlanExtractor.fromArguments(arguments).orElseThrow());
    }

    @Test
    void shouldReturnEmptyWithoutPlanArray() throws Exception {
        assertTrue(PlanExtractor.fromArguments(mapper.readTree("{\"explanation\": \"none\"}")).isEmpty());
        assertTrue(PlanExtractor.fromArguments(mapper.readTree("{\"plan\": \"not a list\"}")).isEmpty());
        assertTrue(PlanExtractor.fromArguments(NullNode.getInstance()).isEmpty());
        assertTrue(PlanExtractor.fromArguments(null).isEmpty());
    }

    @Test
    void shouldConvertPlanItemsDefaultingMissingStatus() {
        List<TodoItem> todos = PlanExtractor.fromPlanItems(Arrays.asList(
                new BackendEvent.PlanItem("Step one", TodoStatus.COMPLETED),
                new BackendEvent.PlanItem("Step two", null)));

        assertEquals(List.of(
                new TodoItem("Step one", TodoStatus.COMPLETED),
                new TodoItem("Step two", TodoStatus.PENDING)), todos);
    }
}
