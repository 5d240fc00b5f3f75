package com.riansoft.pickup_routing.solver;

/**
 * solver에 독립적인 결정 변수입니다. index 는 {@link MilpModel} 안에서의 위치입니다.
 */
public class MilpVariable {

    public enum Kind {
        BINARY,
        INTEGER
    }

    public final int index;
    public final String name;
    public final Kind kind;
    public final double lowerBound;
    public final double upperBound;

    MilpVariable(int index, String name, Kind kind, double lowerBound, double upperBound) {
        this.index = index;
        this.name = name;
        this.kind = kind;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    @Override
    public String toString() {
        return name;
    }
}
