package com.ryuqq.swarm.application.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 완료된 Task의 실행 시간 통계 (ms).
 *
 * @param count 표본 수
 * @param averageMs 평균
 * @param minMs 최소
 * @param maxMs 최대
 * @param medianMs 중앙값 (표본이 짝수이면 가운데 두 값의 평균)
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public record ExecutionStats(
    int count,
    double averageMs,
    long minMs,
    long maxMs,
    double medianMs
) {

    public static ExecutionStats empty() {
        return new ExecutionStats(0, 0.0, 0, 0, 0.0);
    }

    public static ExecutionStats of(Collection<Long> durationsMs) {
        if (durationsMs == null || durationsMs.isEmpty()) {
            return empty();
        }
        List<Long> sorted = new ArrayList<>(durationsMs);
        Collections.sort(sorted);
        long sum = 0;
        for (long duration : sorted) {
            sum += duration;
        }
        int size = sorted.size();
        double median = size % 2 == 1
            ? sorted.get(size / 2)
            : (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        return new ExecutionStats(size, (double) sum / size, sorted.get(0), sorted.get(size - 1), median);
    }
}
