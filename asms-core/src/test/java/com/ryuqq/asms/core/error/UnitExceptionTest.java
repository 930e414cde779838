package com.ryuqq.asms.core.error;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UnitException 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class UnitExceptionTest {

    @Test
    void wrap_원래_코드와_도메인_유지() {
        // given
        UnitException original = UnitException.of("alert", ErrorCode.ALERT_RULE_NOT_FOUND, "alert rule not found: r1");

        // when
        UnitException wrapped = UnitException.wrap("update rule", original);

        // then
        assertThat(wrapped.getCode()).isEqualTo(ErrorCode.ALERT_RULE_NOT_FOUND);
        assertThat(wrapped.getDomain()).isEqualTo("alert");
        assertThat(wrapped.getMessage()).isEqualTo("update rule: alert rule not found: r1");
        assertThat(wrapped.getCause()).isSameAs(original);
    }

    @Test
    void wrap_일반_예외는_internal_error() {
        // when
        UnitException wrapped = UnitException.wrap("load", new IllegalStateException("boom"));

        // then
        assertThat(wrapped.getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(wrapped.getMessage()).isEqualTo("load: boom");
    }

    @Test
    void hasCode_중첩_래핑에서도_코드_탐색() {
        // given
        UnitException root = UnitException.of(ErrorCode.SERVICE_NOT_FOUND, "service not found: svc-1");
        RuntimeException outer = new RuntimeException("outer", UnitException.wrap("get service", root));

        // when & then
        assertThat(UnitException.hasCode(outer, ErrorCode.SERVICE_NOT_FOUND)).isTrue();
        assertThat(UnitException.hasCode(outer, ErrorCode.ALREADY_EXISTS)).isFalse();
        assertThat(UnitException.isNotFound(outer)).isTrue();
    }

    @Test
    void find_체인에_없으면_empty() {
        assertThat(UnitException.find(new RuntimeException("plain"))).isEqualTo(Optional.empty());
        assertThat(UnitException.find(null)).isEmpty();
    }

    @Test
    void 분류_헬퍼() {
        assertThat(UnitException.isAlreadyExists(UnitException.of(ErrorCode.ALREADY_EXISTS, "dup"))).isTrue();
        assertThat(UnitException.isTimeout(UnitException.of(ErrorCode.INFERENCE_TIMEOUT, "slow"))).isTrue();
        assertThat(UnitException.isRateLimited(UnitException.of(ErrorCode.RATE_LIMITED, "busy"))).isTrue();
        assertThat(UnitException.isNotFound(UnitException.of(ErrorCode.INVALID_INPUT, "bad"))).isFalse();
    }

    @Test
    void withDetail_새_예외에_정보_추가() {
        // given
        UnitException base = UnitException.of(ErrorCode.INVALID_INPUT, "bad");

        // when
        UnitException detailed = base.withDetail("field", "name");

        // then
        assertThat(detailed.getDetails()).containsEntry("field", "name");
        assertThat(base.getDetails()).isEmpty();
        assertThat(detailed.is(ErrorCode.INVALID_INPUT)).isTrue();
    }

    @Test
    void code_null이면_예외() {
        assertThatThrownBy(() -> new UnitException(null, "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("code cannot be null");
    }

    @Test
    void fromValue_토큰으로_코드_조회() {
        assertThat(ErrorCode.fromValue("alert_rule_not_found")).contains(ErrorCode.ALERT_RULE_NOT_FOUND);
        assertThat(ErrorCode.fromValue("nope")).isEmpty();
    }
}
