package com.ryuqq.swarm.core.error;

/**
 * 지원하지 않는 Launch 모드 (CONTAINER, REMOTE).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public class UnsupportedLaunchModeException extends UnsupportedOperationException {

    private final String mode;

    public UnsupportedLaunchModeException(String mode) {
        super("Launch mode not supported: " + mode);
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
