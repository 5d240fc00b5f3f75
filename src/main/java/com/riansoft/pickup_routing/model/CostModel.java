package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.exception.ValidationException;

import java.util.Locale;

/**
 * 경로 운행 비용 계산 방식입니다.
 * FLAT 은 운행 분당 고정 비용, ITEMIZED 는 마일당 유류비 + 시간당 인건비입니다.
 */
public class CostModel {

    public enum Type {
        FLAT,
        ITEMIZED;

        public static Type parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return FLAT;
            }
            try {
                return Type.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("알 수 없는 비용 모델입니다: '" + raw + "'");
            }
        }
    }

    public final Type type;
    public final double flatRouteCostPerMinute;
    public final double gasCostPerMile;
    public final double staffCostPerHour;

    private CostModel(Type type, double flatRouteCostPerMinute, double gasCostPerMile, double staffCostPerHour) {
        this.type = type;
        this.flatRouteCostPerMinute = flatRouteCostPerMinute;
        this.gasCostPerMile = gasCostPerMile;
        this.staffCostPerHour = staffCostPerHour;
    }

    public static CostModel flat(double costPerMinute) {
        requireNonNegative("flatRouteCostPerMinute", costPerMinute);
        return new CostModel(Type.FLAT, costPerMinute, 0, 0);
    }

    public static CostModel itemized(double gasCostPerMile, double staffCostPerHour) {
        requireNonNegative("gasCostPerMile", gasCostPerMile);
        requireNonNegative("staffCostPerHour", staffCostPerHour);
        return new CostModel(Type.ITEMIZED, 0, gasCostPerMile, staffCostPerHour);
    }

    public boolean needsDistance() {
        return type == Type.ITEMIZED;
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ValidationException("비용 계수 " + field + " 값이 올바르지 않습니다: " + value);
        }
    }

    @Override
    public String toString() {
        return type == Type.FLAT
                ? "FLAT(" + flatRouteCostPerMinute + "/분)"
                : "ITEMIZED(" + gasCostPerMile + "/마일, " + staffCostPerHour + "/시간)";
    }
}
