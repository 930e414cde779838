package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 객체 검출 박스 (x, y, width, height).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BBox(double x, double y, double width, double height) {

    public List<Double> toList() {
        return List.of(x, y, width, height);
    }
}
