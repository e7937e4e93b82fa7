/**
 * 세션 결과 집계.
 *
 * <p>{@link com.ryuqq.swarm.application.report.SessionResultAggregator}는 Memory Coordinator에
 * 미러링된 세션 레코드와 Agent 등록 정보만으로 요약을 만듭니다.</p>
 *
 * @since 1.0.0
 * @author Swarm Team
 */
package com.ryuqq.swarm.application.report;
