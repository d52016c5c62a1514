package com.agentmesh.core.bus;

public enum MessageType {
    TASK_ASSIGNMENT,
    TASK_RESULT,
    REQUEST,
    RESPONSE,
    BROADCAST,
    NOTIFICATION,
    HEARTBEAT
}
