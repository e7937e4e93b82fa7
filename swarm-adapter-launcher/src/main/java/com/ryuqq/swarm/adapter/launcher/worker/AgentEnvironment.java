package com.ryuqq.swarm.adapter.launcher.worker;

/**
 * 프로세스 모드 Agent에 전달되는 환경 변수 이름.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class AgentEnvironment {

    public static final String AGENT_ID = "SWARM_AGENT_ID";
    public static final String SESSION_ID = "SWARM_SESSION_ID";
    public static final String AGENT_NAME = "SWARM_AGENT_NAME";
    /** JSON 배열 */
    public static final String CAPABILITIES = "SWARM_CAPABILITIES";
    public static final String HEARTBEAT_INTERVAL_MS = "SWARM_HEARTBEAT_INTERVAL_MS";
    public static final String MAX_TASKS = "SWARM_MAX_TASKS";
    public static final String MEMORY_LIMIT_MB = "SWARM_MEMORY_LIMIT_MB";
    public static final String CPU_LIMIT_PERCENT = "SWARM_CPU_LIMIT_PERCENT";
    public static final String LAUNCH_MODE = "SWARM_LAUNCH_MODE";
    public static final String STORE_URL = "SWARM_STORE_URL";

    private AgentEnvironment() {
    }
}
