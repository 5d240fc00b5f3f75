package com.riansoft.pickup_routing.solver;

/**
 * solver가 돌려준 원시 배정 결과입니다. 해가 없으면 values 는 null 입니다.
 */
public class SolverOutcome {
    public final SolverStatus status;
    private final double[] values;
    public final double objectiveValue;
    public final long wallTimeMillis;

    public SolverOutcome(SolverStatus status, double[] values, double objectiveValue, long wallTimeMillis) {
        this.status = status;
        this.values = values == null ? null : values.clone();
        this.objectiveValue = objectiveValue;
        this.wallTimeMillis = wallTimeMillis;
    }

    public static SolverOutcome infeasible(long wallTimeMillis) {
        return new SolverOutcome(SolverStatus.INFEASIBLE, null, Double.NaN, wallTimeMillis);
    }

    public static SolverOutcome timedOutWithoutSolution(long wallTimeMillis) {
        return new SolverOutcome(SolverStatus.TIME_LIMIT_REACHED, null, Double.NaN, wallTimeMillis);
    }

    public boolean hasSolution() {
        return values != null;
    }

    public double value(MilpVariable variable) {
        if (values == null) {
            throw new IllegalStateException("solver 결과에 해가 없습니다. (status=" + status + ")");
        }
        return values[variable.index];
    }

    /** 0/1 변수를 반올림해서 읽습니다. */
    public boolean isSelected(MilpVariable variable) {
        return value(variable) > 0.5;
    }

    public double[] values() {
        return values == null ? null : values.clone();
    }
}
