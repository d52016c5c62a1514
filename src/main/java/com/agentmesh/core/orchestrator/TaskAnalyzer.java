package com.agentmesh.core.orchestrator;

import com.agentmesh.core.model.Task;
import com.agentmesh.core.scaling.ScalingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores how complex a task is from wording cues, requirement count and description length:
 * {@code min((indicators*0.2 + requirements*0.1 + words/200) / 3, 1)}.
 */
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    private static final Map<String, Pattern> INDICATORS = new LinkedHashMap<>();

    static {
        INDICATORS.put("comparison", Pattern.compile("\\b(?:compar\\w*|versus|vs)\\b"));
        INDICATORS.put("analysis", Pattern.compile("\\b(?:analy[sz]\\w*|examin\\w*|evaluat\\w*|assess\\w*)\\b"));
        INDICATORS.put("research", Pattern.compile("\\b(?:research\\w*|investigat\\w*|stud(?:y|ies)|explor\\w*)\\b"));
        INDICATORS.put("multiple_topics", Pattern.compile("\\b(?:and|or|also|additionally)\\b"));
        INDICATORS.put("depth", Pattern.compile("\\b(?:detailed|comprehensive|thorough|in-depth)\\b"));
    }

    private final ScalingStrategy scalingStrategy;

    public TaskAnalyzer(ScalingStrategy scalingStrategy) {
        this.scalingStrategy = scalingStrategy;
    }

    public TaskAnalysis analyze(Task task, int availableAgents) {
        String text = task.description().toLowerCase(Locale.ROOT);
        var indicators = new LinkedHashMap<String, Integer>();
        INDICATORS.forEach((name, pattern) -> indicators.put(name, count(pattern, text)));

        int total = indicators.values().stream().mapToInt(Integer::intValue).sum();
        int words = task.descriptionWords().size();
        double score = Math.min((total * 0.2 + task.requirements().size() * 0.1 + words / 200.0) / 3.0, 1.0);
        var type = ComplexityType.fromScore(score);

        var analysis = new TaskAnalysis(
                score,
                type,
                Map.copyOf(indicators),
                estimateAgents(score),
                indicators.get("comparison") + indicators.get("multiple_topics"),
                scalingStrategy.assessComplexity(task),
                scalingStrategy.getAgentAllocation(task, availableAgents),
                scalingStrategy.getDecompositionStrategy(task));
        log.info("Task {} analysed: {} (score {}, {} indicator(s), {} requirement(s), scaling level {})",
                task.id(), type.label(), String.format("%.3f", score), total, task.requirements().size(),
                analysis.assessment().level());
        return analysis;
    }

    static int estimateAgents(double score) {
        if (score < 0.3) return 1;
        if (score < 0.6) return 3;
        return Math.max(6, Math.min((int) (score * 15), 12));
    }

    private static int count(Pattern pattern, String text) {
        var matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
