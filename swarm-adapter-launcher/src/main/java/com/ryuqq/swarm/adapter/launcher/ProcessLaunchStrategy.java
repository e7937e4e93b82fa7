package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.worker.AgentWorkerMain;
import com.ryuqq.swarm.core.error.AgentLaunchException;
import com.ryuqq.swarm.core.model.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 독립 OS 프로세스로 {@link AgentWorkerMain}을 실행.
 *
 * <p>부모 JVM의 java 실행 파일과 클래스패스를 사용하며, 메모리 제한은 {@code -Xmx}로 전달합니다.
 * Agent 식별자, 세션, capability, heartbeat 주기, 최대 Task 수는 환경 변수로 전달합니다.
 * 시작 후 {@code postLaunchCheckMs} 안에 종료되면 실패로 처리합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class ProcessLaunchStrategy implements LaunchStrategy {

    private static final Logger log = LoggerFactory.getLogger(ProcessLaunchStrategy.class);

    /**
     * 프로세스 시작 지점 (테스트에서 교체).
     */
    @FunctionalInterface
    public interface ProcessStarter {
        Process start(List<String> command, Map<String, String> environment) throws IOException;
    }

    private final LauncherConfig config;
    private final Clock clock;
    private final ProcessStarter starter;

    public ProcessLaunchStrategy(LauncherConfig config, Clock clock) {
        this(config, clock, ProcessLaunchStrategy::startProcess);
    }

    ProcessLaunchStrategy(LauncherConfig config, Clock clock, ProcessStarter starter) {
        this.config = config;
        this.clock = clock;
        this.starter = starter;
    }

    @Override
    public AgentHandle launch(SessionId sessionId, AgentConfig agentConfig) {
        List<String> command = command(agentConfig);
        Map<String, String> environment = new LinkedHashMap<>(agentConfig.environment());
        environment.putAll(LaunchStrategy.workerConfig(sessionId, agentConfig, config.storeUrl()).toEnvironment());

        Process process;
        try {
            process = starter.start(command, environment);
        } catch (IOException | UnsupportedOperationException e) {
            throw new AgentLaunchException("Could not start process for agent " + agentConfig.id() + ": " + e.getMessage(), e);
        }

        try {
            if (process.waitFor(config.postLaunchCheckMs(), TimeUnit.MILLISECONDS)) {
                throw new AgentLaunchException(
                    "Agent process exited immediately (agent: " + agentConfig.id() + ", exit code: " + process.exitValue() + ")"
                );
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AgentLaunchException("Interrupted while checking process of agent " + agentConfig.id(), e);
        }

        log.debug("Agent process started: {} (pid: {})", agentConfig.id(), process.pid());
        return new OsProcessHandle(process, clock);
    }

    static List<String> command(AgentConfig agentConfig) {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-Xmx" + agentConfig.resourceLimits().memoryMb() + "m");
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(AgentWorkerMain.class.getName());
        return command;
    }

    private static Process startProcess(List<String> command, Map<String, String> environment) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);
        builder.inheritIO();
        return builder.start();
    }
}
