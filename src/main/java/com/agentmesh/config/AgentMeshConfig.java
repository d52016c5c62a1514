package com.agentmesh.config;

import com.agentmesh.core.agent.CodeAgent;
import com.agentmesh.core.agent.DataAnalysisAgent;
import com.agentmesh.core.agent.GeneralAgent;
import com.agentmesh.core.agent.ResearchAgent;
import com.agentmesh.core.agent.TestAgent;
import com.agentmesh.core.agent.WorkerAgent;
import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.bus.MessageBus;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.fallback.FallbackRegistry;
import com.agentmesh.core.learning.JsonLearningTableStore;
import com.agentmesh.core.learning.LearningTableStore;
import com.agentmesh.core.learning.LearningTableSync;
import com.agentmesh.core.learning.PolicyGradientEngine;
import com.agentmesh.core.learning.QLearningEngine;
import com.agentmesh.core.llm.ReasoningClient;
import com.agentmesh.core.llm.SpringAiReasoningClient;
import com.agentmesh.core.llm.UnavailableReasoningClient;
import com.agentmesh.core.memory.ContextMaintenance;
import com.agentmesh.core.memory.ContextProtocol;
import com.agentmesh.core.memory.Embedder;
import com.agentmesh.core.memory.HashEmbedder;
import com.agentmesh.core.memory.MemoryManager;
import com.agentmesh.core.memory.SemanticMemory;
import com.agentmesh.core.metrics.AgentMeshMetrics;
import com.agentmesh.core.orchestrator.DelegationPlanner;
import com.agentmesh.core.orchestrator.Orchestrator;
import com.agentmesh.core.orchestrator.TaskAnalyzer;
import com.agentmesh.core.orchestrator.TaskDecomposer;
import com.agentmesh.core.persistence.InMemoryTaskStore;
import com.agentmesh.core.persistence.TaskStore;
import com.agentmesh.core.scaling.LoadBalancer;
import com.agentmesh.core.scaling.ScalingStrategy;
import com.agentmesh.core.submission.TaskSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the mesh: bus, memory, learning engines, the five workers and the orchestrator.
 */
@Configuration
@EnableConfigurationProperties(AgentMeshProperties.class)
public class AgentMeshConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentMeshConfig.class);

    static final String RESEARCH_AGENT = "research-1";
    static final String CODE_AGENT = "code-1";
    static final String TEST_AGENT = "test-1";
    static final String ANALYSIS_AGENT = "analysis-1";
    static final String GENERAL_AGENT = "general-1";

    private static final String TABLES_ENABLED = "!'${agentmesh.learning.table-directory:}'.isBlank()";

    // -- Infrastructure -------------------------------------------------------

    @Bean(destroyMethod = "shutdown")
    public MessageBus messageBus(AgentMeshProperties properties, AgentMeshMetrics metrics) {
        var bus = new MessageBus(properties.getBus().getQueueCapacity(), properties.getBus().getHistorySize());
        metrics.bindMessageBus(bus);
        return bus;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fallbackExecutor(AgentMeshProperties properties) {
        return Executors.newFixedThreadPool(properties.getFallback().getParallelThreads(), daemonThreads("fallback"));
    }

    @Bean
    public FallbackRegistry fallbackRegistry(@Qualifier("fallbackExecutor") ExecutorService fallbackExecutor,
                                             AgentMeshMetrics metrics) {
        return new FallbackRegistry(fallbackExecutor, metrics);
    }

    @Bean
    public ScalingStrategy scalingStrategy() {
        return new ScalingStrategy();
    }

    @Bean
    public LoadBalancer loadBalancer() {
        return new LoadBalancer();
    }

    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    public TaskStore taskStore() {
        return new InMemoryTaskStore();
    }

    @Bean
    public ReasoningClient reasoningClient(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No ChatModel configured, agents will use their local fallbacks");
            return new UnavailableReasoningClient();
        }
        log.info("Reasoning backend: {}", model.getClass().getSimpleName());
        return new SpringAiReasoningClient(ChatClient.builder(model).build());
    }

    // -- Memory ---------------------------------------------------------------

    @Bean
    public Embedder embedder(AgentMeshProperties properties) {
        return new HashEmbedder(properties.getMemory().getEmbeddingDimension());
    }

    @Bean
    public SemanticMemory semanticMemory(Embedder embedder, AgentMeshProperties properties) {
        return new SemanticMemory(embedder, properties.getMemory().getSemanticCapacity());
    }

    @Bean
    public ContextProtocol contextProtocol() {
        return new ContextProtocol(Clock.systemUTC());
    }

    @Bean
    public ContextMaintenance contextMaintenance(ContextProtocol contextProtocol, AgentMeshProperties properties) {
        return new ContextMaintenance(contextProtocol, properties.getMemory().getContextSweepInterval());
    }

    @Bean
    public MemoryManager generalAgentMemory(AgentMeshProperties properties) {
        return new MemoryManager(properties.getMemory().getShortTermCapacity(),
                properties.getMemory().getConsolidationThreshold());
    }

    // -- Learning -------------------------------------------------------------

    @Bean
    public QLearningEngine codeApproachLearner(AgentMeshProperties properties) {
        return new QLearningEngine(properties.getLearning().getQLearning(), new Random());
    }

    @Bean
    public PolicyGradientEngine generalStylePolicy(AgentMeshProperties properties) {
        return new PolicyGradientEngine(properties.getLearning().getPolicyGradient(), new Random());
    }

    @Bean
    @ConditionalOnExpression(TABLES_ENABLED)
    public LearningTableStore learningTableStore(AgentMeshProperties properties) {
        return new JsonLearningTableStore(Path.of(properties.getLearning().getTableDirectory()));
    }

    @Bean
    @ConditionalOnExpression(TABLES_ENABLED)
    public LearningTableSync codeApproachSync(LearningTableStore store,
                                              @Qualifier("codeApproachLearner") QLearningEngine engine) {
        return LearningTableSync.of(store, CODE_AGENT + ".approach", engine);
    }

    @Bean
    @ConditionalOnExpression(TABLES_ENABLED)
    public LearningTableSync generalStyleSync(LearningTableStore store,
                                              @Qualifier("generalStylePolicy") PolicyGradientEngine engine) {
        return LearningTableSync.of(store, GENERAL_AGENT + ".style", engine);
    }

    // -- Workers --------------------------------------------------------------

    @Bean
    public ResearchAgent researchAgent(ReasoningClient reasoningClient, SemanticMemory semanticMemory,
                                       ContextProtocol contextProtocol) {
        return new ResearchAgent(RESEARCH_AGENT, reasoningClient, semanticMemory, contextProtocol);
    }

    @Bean
    public CodeAgent codeAgent(ReasoningClient reasoningClient,
                               @Qualifier("codeApproachLearner") QLearningEngine approachLearner,
                               FallbackRegistry fallbackRegistry) {
        return new CodeAgent(CODE_AGENT, reasoningClient, approachLearner, fallbackRegistry);
    }

    @Bean
    public TestAgent testAgent() {
        return new TestAgent(TEST_AGENT);
    }

    @Bean
    public DataAnalysisAgent dataAnalysisAgent() {
        return new DataAnalysisAgent(ANALYSIS_AGENT);
    }

    @Bean
    public GeneralAgent generalAgent(ReasoningClient reasoningClient,
                                     @Qualifier("generalAgentMemory") MemoryManager memory,
                                     @Qualifier("generalStylePolicy") PolicyGradientEngine stylePolicy) {
        return new GeneralAgent(GENERAL_AGENT, reasoningClient, memory, stylePolicy);
    }

    @Bean
    public WorkerPool workerPool(MessageBus messageBus, List<WorkerAgent> agents, AgentMeshProperties properties) {
        return new WorkerPool(messageBus, properties.getOrchestrator().getWorkerPollInterval(), agents);
    }

    // -- Orchestration --------------------------------------------------------

    @Bean
    public TaskAnalyzer taskAnalyzer(ScalingStrategy scalingStrategy) {
        return new TaskAnalyzer(scalingStrategy);
    }

    @Bean
    public TaskDecomposer taskDecomposer() {
        return new TaskDecomposer();
    }

    @Bean
    public DelegationPlanner delegationPlanner(WorkerPool workerPool, LoadBalancer loadBalancer) {
        return new DelegationPlanner(workerPool, loadBalancer);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService dispatchExecutor(AgentMeshProperties properties) {
        return Executors.newFixedThreadPool(properties.getOrchestrator().getDispatchThreads(), daemonThreads("dispatch"));
    }

    @Bean
    public Orchestrator orchestrator(MessageBus messageBus, WorkerPool workerPool, TaskAnalyzer taskAnalyzer,
                                     TaskDecomposer taskDecomposer, DelegationPlanner delegationPlanner,
                                     LoadBalancer loadBalancer, TaskStore taskStore, EventBus eventBus,
                                     AgentMeshMetrics metrics,
                                     @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
                                     AgentMeshProperties properties) {
        return new Orchestrator(messageBus, workerPool, taskAnalyzer, taskDecomposer, delegationPlanner,
                loadBalancer, taskStore, eventBus, metrics, dispatchExecutor,
                properties.getOrchestrator().getSubtaskTimeout(), properties.getBus().getDefaultTtl(),
                properties.getOrchestrator().getRetainedTasks());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService submissionExecutor(AgentMeshProperties properties) {
        return Executors.newFixedThreadPool(properties.getOrchestrator().getSubmissionThreads(),
                daemonThreads("submission"));
    }

    @Bean
    public TaskSubmissionService taskSubmissionService(Orchestrator orchestrator,
                                                       @Qualifier("submissionExecutor") ExecutorService executor,
                                                       AgentMeshProperties properties) {
        return new TaskSubmissionService(orchestrator, executor, properties.getOrchestrator().getRetainedTasks());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
