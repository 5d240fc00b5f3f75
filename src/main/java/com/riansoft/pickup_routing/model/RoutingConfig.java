package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.exception.ValidationException;

import java.time.Duration;

/**
 * 한 번의 최적화 실행에 쓰이는 읽기 전용 설정입니다.
 * 운행 시간 제한은 항상 분 단위로 정규화되어 저장됩니다.
 */
public class RoutingConfig {
    public final double maxDriveTimeMinutes;
    public final int maxRoutes;
    public final CostModel costModel;
    public final String startId;
    public final String endId;
    public final Duration solveTimeLimit;

    private RoutingConfig(Builder builder) {
        this.maxDriveTimeMinutes = builder.maxDriveTimeMinutes;
        this.maxRoutes = builder.maxRoutes;
        this.costModel = builder.costModel;
        this.startId = builder.startId;
        this.endId = builder.endId;
        this.solveTimeLimit = builder.solveTimeLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSingleRoute() {
        return maxRoutes == 1;
    }

    /** 출발 지점 ID. 지정하지 않으면 허브입니다. */
    public String resolveStart(LocationGraph graph) {
        return startId == null ? graph.hub().id : startId;
    }

    /** 도착 지점 ID. 지정하지 않으면 허브입니다. */
    public String resolveEnd(LocationGraph graph) {
        return endId == null ? graph.hub().id : endId;
    }

    /**
     * 그래프와 함께 설정을 검사합니다. 모델을 만들기 전에 호출됩니다.
     */
    public void validateAgainst(LocationGraph graph) {
        String start = resolveStart(graph);
        String end = resolveEnd(graph);
        if (!graph.contains(start)) {
            throw new ValidationException("출발 지점 '" + start + "'이 그래프에 없습니다.");
        }
        if (!graph.contains(end)) {
            throw new ValidationException("도착 지점 '" + end + "'이 그래프에 없습니다.");
        }
        if (costModel.needsDistance()) {
            for (Location from : graph.locations()) {
                for (Location to : graph.locations()) {
                    if (from.id.equals(to.id)) continue;
                    if (!graph.hasDistance(from.id, to.id)) {
                        throw new ValidationException("ITEMIZED 비용 모델에는 모든 구간의 거리가 필요합니다. 누락: '"
                                + from.id + "' -> '" + to.id + "'");
                    }
                }
            }
        }
    }

    @Override
    public String toString() {
        return "RoutingConfig{maxDriveTimeMinutes=" + maxDriveTimeMinutes + ", maxRoutes=" + maxRoutes
                + ", costModel=" + costModel + ", start=" + startId + ", end=" + endId + "}";
    }

    public static class Builder {
        private double maxDriveTimeMinutes = Double.NaN;
        private int maxRoutes = 1;
        private CostModel costModel = CostModel.flat(1.0);
        private String startId;
        private String endId;
        private Duration solveTimeLimit;

        public Builder maxDriveTimeMinutes(double minutes) {
            this.maxDriveTimeMinutes = minutes;
            return this;
        }

        public Builder maxDriveTimeHours(double hours) {
            this.maxDriveTimeMinutes = hours * 60;
            return this;
        }

        public Builder maxRoutes(int maxRoutes) {
            this.maxRoutes = maxRoutes;
            return this;
        }

        public Builder singleRoute() {
            this.maxRoutes = 1;
            return this;
        }

        public Builder costModel(CostModel costModel) {
            this.costModel = costModel;
            return this;
        }

        public Builder start(String startId) {
            this.startId = blankToNull(startId);
            return this;
        }

        public Builder end(String endId) {
            this.endId = blankToNull(endId);
            return this;
        }

        public Builder solveTimeLimit(Duration solveTimeLimit) {
            this.solveTimeLimit = solveTimeLimit;
            return this;
        }

        public RoutingConfig build() {
            if (!Double.isFinite(maxDriveTimeMinutes) || maxDriveTimeMinutes <= 0) {
                throw new ValidationException("최대 운행 시간은 0보다 커야 합니다: " + maxDriveTimeMinutes);
            }
            if (maxRoutes < 1) {
                throw new ValidationException("최대 경로 수는 1 이상이어야 합니다: " + maxRoutes);
            }
            if (costModel == null) {
                throw new ValidationException("비용 모델이 지정되지 않았습니다.");
            }
            if (solveTimeLimit != null && (solveTimeLimit.isNegative() || solveTimeLimit.isZero())) {
                throw new ValidationException("solver 시간 제한은 0보다 커야 합니다: " + solveTimeLimit);
            }
            return new RoutingConfig(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
