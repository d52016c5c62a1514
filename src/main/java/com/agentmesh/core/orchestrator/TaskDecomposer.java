package com.agentmesh.core.orchestrator;

import com.agentmesh.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits a task into subtasks, one per focus area.
 * <p>
 * A task with requirements is split per requirement when it scores above 0.5 or has more than
 * one; a single requirement on a low-scoring task keeps it whole. A task without requirements is
 * split by the work keywords its description mentions, and kept whole when it mentions none.
 */
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    static final double SPLIT_THRESHOLD = 0.5;

    /** Keyword vocabulary; each keyword is also the capability name its subtask requires. */
    static final Map<String, Pattern> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("research", Pattern.compile("\\b(?:research\\w*|investigat\\w*|explor\\w*|find out)\\b"));
        KEYWORDS.put("code", Pattern.compile("\\b(?:code|coding|implement\\w*|program\\w*|develop\\w*)\\b"));
        KEYWORDS.put("test", Pattern.compile("\\b(?:test\\w*|verif\\w*|validat\\w*)\\b"));
        KEYWORDS.put("analyze", Pattern.compile("\\b(?:analy[sz]\\w*|statistic\\w*|data)\\b"));
        KEYWORDS.put("document", Pattern.compile("\\b(?:document\\w*|write|summar\\w*|report\\w*)\\b"));
    }

    /**
     * @return the subtasks, or a list holding only {@code task} when it is not split
     */
    public List<Task> decompose(Task task, TaskAnalysis analysis) {
        List<String> focusAreas;
        if (!task.requirements().isEmpty()) {
            boolean split = analysis.score() > SPLIT_THRESHOLD || task.requirements().size() > 1;
            focusAreas = split ? task.requirements() : List.of();
        } else {
            focusAreas = matchKeywords(task.description());
        }
        if (focusAreas.isEmpty()) {
            log.debug("Task {} kept whole", task.id());
            return List.of(task);
        }

        var subtasks = new ArrayList<Task>(focusAreas.size());
        for (int i = 0; i < focusAreas.size(); i++) {
            String focus = focusAreas.get(i);
            subtasks.add(Task.subtaskOf(task, instructions(task, focus, i, focusAreas.size()), List.of(focus),
                    Map.of("subtask_index", i, "total_subtasks", focusAreas.size(), "focus_area", focus)));
        }
        log.info("Task {} decomposed into {} subtask(s): {}", task.id(), subtasks.size(), focusAreas);
        return subtasks;
    }

    static List<String> matchKeywords(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        var matched = new ArrayList<String>();
        KEYWORDS.forEach((keyword, pattern) -> {
            if (pattern.matcher(text).find()) {
                matched.add(keyword);
            }
        });
        return matched;
    }

    static String instructions(Task parent, String focus, int index, int total) {
        return """
                SUBTASK %d of %d
                OBJECTIVE: %s
                PARENT TASK: %s

                INSTRUCTIONS:
                1. Work only on the %s part of the parent task.
                2. Give specific, checkable output with a confidence for each claim.
                3. Mark assumptions and anything left open for the other subtasks.
                """.formatted(index + 1, total, focus, parent.description(), focus);
    }
}
