package com.riansoft.pickup_routing.solver;

/**
 * lowerBound <= expression <= upperBound 형태의 선형 제약입니다.
 * 식의 상수항은 양쪽 한계에서 미리 빼서 저장합니다.
 */
public class LinearConstraint {
    public final String name;
    public final LinearExpression expression;
    public final double lowerBound;
    public final double upperBound;

    private LinearConstraint(String name, LinearExpression expression, double lowerBound, double upperBound) {
        this.name = name;
        this.expression = expression;
        this.lowerBound = lowerBound - expression.constant();
        this.upperBound = upperBound - expression.constant();
    }

    public static LinearConstraint equalTo(String name, LinearExpression expression, double value) {
        return new LinearConstraint(name, expression, value, value);
    }

    public static LinearConstraint atMost(String name, LinearExpression expression, double value) {
        return new LinearConstraint(name, expression, Double.NEGATIVE_INFINITY, value);
    }

    public static LinearConstraint atLeast(String name, LinearExpression expression, double value) {
        return new LinearConstraint(name, expression, value, Double.POSITIVE_INFINITY);
    }

    public boolean isEquality() {
        return lowerBound == upperBound;
    }

    @Override
    public String toString() {
        return name + ": " + lowerBound + " <= ... <= " + upperBound;
    }
}
