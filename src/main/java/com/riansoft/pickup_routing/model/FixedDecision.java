package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.exception.ValidationException;

import java.util.Locale;

/**
 * 운영자가 solver 실행 전에 강제하는 배정입니다.
 */
public enum FixedDecision {
    UNCONSTRAINED,
    FORCE_DIRECT,
    FORCE_ROUTE;

    /**
     * 입력 테이블의 문자열 값을 해석합니다. null 또는 공백은 UNCONSTRAINED 입니다.
     * "force-direct", "FORCE_DIRECT", "direct" 처럼 표기가 달라도 허용합니다.
     */
    public static FixedDecision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNCONSTRAINED;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (normalized) {
            case "UNCONSTRAINED":
            case "NONE":
                return UNCONSTRAINED;
            case "FORCE_DIRECT":
            case "DIRECT":
                return FORCE_DIRECT;
            case "FORCE_ROUTE":
            case "ROUTE":
                return FORCE_ROUTE;
            default:
                throw new ValidationException("알 수 없는 고정 결정 값입니다: '" + raw + "'");
        }
    }
}
