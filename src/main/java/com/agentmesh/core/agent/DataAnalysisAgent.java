package com.agentmesh.core.agent;

import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Descriptive statistics over the numeric values in a task's {@code data} context entry.
 * Non-numeric values are skipped and lower the reported quality.
 */
public final class DataAnalysisAgent implements WorkerAgent {

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("analyze", "Statistical analysis of data sets", 0.9),
            new AgentCapability("data", "Data processing", 0.8),
            new AgentCapability("research", "Quantitative research", 0.3));

    private final String agentId;

    public DataAnalysisAgent(String agentId) {
        this.agentId = agentId;
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public List<AgentCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Result processTask(Task task) {
        long start = System.nanoTime();
        Object data = task.context().get("data");
        var values = new ArrayList<Double>();
        int total = 0;
        if (data instanceof Collection<?> items) {
            total = items.size();
            for (Object item : items) {
                if (item instanceof Number n && Double.isFinite(n.doubleValue())) {
                    values.add(n.doubleValue());
                }
            }
        }
        if (values.isEmpty()) {
            return Result.failure(task.id(), agentId, "No numeric data to analyze",
                    Duration.ofNanos(System.nanoTime() - start));
        }

        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.size();
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }

        var stats = new LinkedHashMap<String, Object>();
        stats.put("count", values.size());
        stats.put("mean", mean);
        stats.put("min", min);
        stats.put("max", max);
        stats.put("stddev", Math.sqrt(squares / values.size()));
        stats.put("skipped", total - values.size());

        double quality = 0.9 * values.size() / total;
        return Result.success(task.id(), agentId, stats, Duration.ofNanos(System.nanoTime() - start), quality);
    }
}
