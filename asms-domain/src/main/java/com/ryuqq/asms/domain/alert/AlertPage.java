package com.ryuqq.asms.domain.alert;

import java.util.List;

/**
 * 페이지 조회 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param alerts 페이지 내 알림
 * @param total 페이지 적용 전 필터 결과 개수
 */
public record AlertPage(List<Alert> alerts, int total) {

    public AlertPage {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        if (total < alerts.size()) {
            throw new IllegalArgumentException("total must not be less than page size (total: " + total + ")");
        }
    }
}
