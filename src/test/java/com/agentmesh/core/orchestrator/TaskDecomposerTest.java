package com.agentmesh.core.orchestrator;

import com.agentmesh.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskDecomposerTest {

    private final TaskDecomposer decomposer = new TaskDecomposer();

    private static TaskAnalysis scored(double score) {
        return new TaskAnalysis(score, ComplexityType.fromScore(score), Map.of(), 1, 0, null, null, null);
    }

    @Nested
    @DisplayName("With requirements")
    class WithRequirements {

        @Test
        @DisplayName("several requirements give one subtask each")
        void onePerRequirement() {
            var task = Task.of("Build a rate limiter", List.of("research", "code"), 7, Map.of("lang", "java"));

            var subtasks = decomposer.decompose(task, scored(0.1));

            assertEquals(2, subtasks.size());
            for (int i = 0; i < subtasks.size(); i++) {
                Task subtask = subtasks.get(i);
                assertEquals(task.id(), subtask.parentTaskId());
                assertEquals(List.of(task.requirements().get(i)), subtask.requirements());
                assertEquals(7, subtask.priority());
                assertEquals("java", subtask.context().get("lang"));
                assertEquals(i, subtask.context().get("subtask_index"));
                assertEquals(2, subtask.context().get("total_subtasks"));
                assertEquals(task.requirements().get(i), subtask.context().get("focus_area"));
            }
            assertEquals(subtasks.stream().map(Task::id).toList(), task.childTaskIds());
        }

        @Test
        @DisplayName("a single requirement keeps a low-scoring task whole")
        void singleRequirementLowScore() {
            var task = Task.of("Fix the typo", "code");
            var subtasks = decomposer.decompose(task, scored(0.2));
            assertEquals(1, subtasks.size());
            assertSame(task, subtasks.get(0));
        }

        @Test
        @DisplayName("a single requirement on a high-scoring task still becomes a subtask")
        void singleRequirementHighScore() {
            var task = Task.of("Rewrite the scheduler", "code");
            var subtasks = decomposer.decompose(task, scored(0.7));
            assertEquals(1, subtasks.size());
            assertNotSame(task, subtasks.get(0));
            assertEquals(task.id(), subtasks.get(0).parentTaskId());
        }
    }

    @Nested
    @DisplayName("Without requirements")
    class WithoutRequirements {

        @Test
        @DisplayName("mentioned work keywords become subtasks in vocabulary order")
        void byKeywords() {
            var task = Task.of("Write docs, then implement the parser and add tests for it");

            var subtasks = decomposer.decompose(task, scored(0.1));

            assertEquals(List.of(List.of("code"), List.of("test"), List.of("document")),
                    subtasks.stream().map(Task::requirements).toList());
        }

        @Test
        @DisplayName("no keywords keeps the task whole")
        void noKeywords() {
            var task = Task.of("Say hello to the team");
            assertSame(task, decomposer.decompose(task, scored(0.9)).get(0));
        }
    }

    @Test
    @DisplayName("subtask instructions name the focus and the parent task")
    void instructions() {
        var parent = Task.of("Ship the release");
        String text = TaskDecomposer.instructions(parent, "test", 0, 2);

        assertTrue(text.startsWith("SUBTASK 1 of 2"));
        assertTrue(text.contains("OBJECTIVE: test"));
        assertTrue(text.contains("PARENT TASK: Ship the release"));
    }
}
