package com.agentmesh.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code agentmesh.*}. Every group has working defaults, so an empty
 * configuration starts a usable mesh.
 */
@ConfigurationProperties(prefix = "agentmesh")
public class AgentMeshProperties {

    private Bus bus = new Bus();
    private Fallback fallback = new Fallback();
    private Memory memory = new Memory();
    private Learning learning = new Learning();
    private Orchestrator orchestrator = new Orchestrator();

    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Fallback getFallback() { return fallback; }
    public void setFallback(Fallback fallback) { this.fallback = fallback; }
    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }
    public Learning getLearning() { return learning; }
    public void setLearning(Learning learning) { this.learning = learning; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }

    public static class Bus {
        private int queueCapacity = 1000;
        private int historySize = 1000;
        /** TTL applied to orchestrator assignments; zero means they never expire. */
        private Duration defaultTtl = Duration.ZERO;

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
    }

    public static class Fallback {
        private int parallelThreads = 8;

        public int getParallelThreads() { return parallelThreads; }
        public void setParallelThreads(int parallelThreads) { this.parallelThreads = parallelThreads; }
    }

    public static class Memory {
        private int shortTermCapacity = 100;
        private double consolidationThreshold = 0.7;
        private int semanticCapacity = 1000;
        private int embeddingDimension = 128;
        private Duration contextSweepInterval = Duration.ofSeconds(60);

        public int getShortTermCapacity() { return shortTermCapacity; }
        public void setShortTermCapacity(int shortTermCapacity) { this.shortTermCapacity = shortTermCapacity; }
        public double getConsolidationThreshold() { return consolidationThreshold; }
        public void setConsolidationThreshold(double consolidationThreshold) { this.consolidationThreshold = consolidationThreshold; }
        public int getSemanticCapacity() { return semanticCapacity; }
        public void setSemanticCapacity(int semanticCapacity) { this.semanticCapacity = semanticCapacity; }
        public int getEmbeddingDimension() { return embeddingDimension; }
        public void setEmbeddingDimension(int embeddingDimension) { this.embeddingDimension = embeddingDimension; }
        public Duration getContextSweepInterval() { return contextSweepInterval; }
        public void setContextSweepInterval(Duration contextSweepInterval) { this.contextSweepInterval = contextSweepInterval; }
    }

    public static class Learning {
        private QLearning qLearning = new QLearning();
        private PolicyGradient policyGradient = new PolicyGradient();
        /** Directory for saved learning tables; blank disables persistence. */
        private String tableDirectory = "";

        public QLearning getQLearning() { return qLearning; }
        public void setQLearning(QLearning qLearning) { this.qLearning = qLearning; }
        public PolicyGradient getPolicyGradient() { return policyGradient; }
        public void setPolicyGradient(PolicyGradient policyGradient) { this.policyGradient = policyGradient; }
        public String getTableDirectory() { return tableDirectory; }
        public void setTableDirectory(String tableDirectory) { this.tableDirectory = tableDirectory; }
    }

    public static class QLearning {
        private double learningRate = 0.1;
        private double discountFactor = 0.9;
        private double explorationRate = 0.2;
        private double explorationDecay = 0.995;
        private double minExplorationRate = 0.01;
        private int replayCapacity = 1000;

        public double getLearningRate() { return learningRate; }
        public void setLearningRate(double learningRate) { this.learningRate = learningRate; }
        public double getDiscountFactor() { return discountFactor; }
        public void setDiscountFactor(double discountFactor) { this.discountFactor = discountFactor; }
        public double getExplorationRate() { return explorationRate; }
        public void setExplorationRate(double explorationRate) { this.explorationRate = explorationRate; }
        public double getExplorationDecay() { return explorationDecay; }
        public void setExplorationDecay(double explorationDecay) { this.explorationDecay = explorationDecay; }
        public double getMinExplorationRate() { return minExplorationRate; }
        public void setMinExplorationRate(double minExplorationRate) { this.minExplorationRate = minExplorationRate; }
        public int getReplayCapacity() { return replayCapacity; }
        public void setReplayCapacity(int replayCapacity) { this.replayCapacity = replayCapacity; }
    }

    public static class PolicyGradient {
        private double learningRate = 0.05;
        private double discountFactor = 0.95;
        private double valueLearningRate = 0.1;

        public double getLearningRate() { return learningRate; }
        public void setLearningRate(double learningRate) { this.learningRate = learningRate; }
        public double getDiscountFactor() { return discountFactor; }
        public void setDiscountFactor(double discountFactor) { this.discountFactor = discountFactor; }
        public double getValueLearningRate() { return valueLearningRate; }
        public void setValueLearningRate(double valueLearningRate) { this.valueLearningRate = valueLearningRate; }
    }

    public static class Orchestrator {
        private Duration subtaskTimeout = Duration.ofSeconds(60);
        private int dispatchThreads = 16;
        private int submissionThreads = 4;
        private Duration workerPollInterval = Duration.ofMillis(500);
        private int retainedTasks = 1000;

        public Duration getSubtaskTimeout() { return subtaskTimeout; }
        public void setSubtaskTimeout(Duration subtaskTimeout) { this.subtaskTimeout = subtaskTimeout; }
        public int getDispatchThreads() { return dispatchThreads; }
        public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }
        public int getSubmissionThreads() { return submissionThreads; }
        public void setSubmissionThreads(int submissionThreads) { this.submissionThreads = submissionThreads; }
        public Duration getWorkerPollInterval() { return workerPollInterval; }
        public void setWorkerPollInterval(Duration workerPollInterval) { this.workerPollInterval = workerPollInterval; }
        public int getRetainedTasks() { return retainedTasks; }
        public void setRetainedTasks(int retainedTasks) { this.retainedTasks = retainedTasks; }
    }
}
