package com.ryuqq.swarm.adapter.launcher;

/**
 * Launch 전 리소스 검사에 사용하는 시스템 정보.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SystemResources {

    /**
     * 현재 사용 가능한 시스템 메모리 (MB).
     */
    long availableMemoryMb();
}
