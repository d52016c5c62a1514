package com.agentmesh.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AgentMesh MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setSubtask(String parentTaskId, String taskId, String agentId) {
        if (parentTaskId != null) {
            MDC.put("parentTaskId", parentTaskId);
        }
        MDC.put("taskId", taskId);
        MDC.put("agentId", agentId);
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("parentTaskId");
        MDC.remove("agentId");
    }
}
