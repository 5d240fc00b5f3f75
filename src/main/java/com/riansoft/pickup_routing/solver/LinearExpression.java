package com.riansoft.pickup_routing.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 변수 계수의 합 + 상수항. 같은 변수를 여러 번 더하면 계수가 합쳐집니다.
 */
public class LinearExpression {

    private final Map<MilpVariable, Double> terms = new LinkedHashMap<>();
    private double constant;

    public LinearExpression plus(MilpVariable variable, double coefficient) {
        terms.merge(variable, coefficient, Double::sum);
        return this;
    }

    public LinearExpression plus(MilpVariable variable) {
        return plus(variable, 1.0);
    }

    public LinearExpression minus(MilpVariable variable) {
        return plus(variable, -1.0);
    }

    public LinearExpression plusConstant(double value) {
        constant += value;
        return this;
    }

    public Map<MilpVariable, Double> terms() {
        return Collections.unmodifiableMap(terms);
    }

    public double coefficient(MilpVariable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    public double constant() {
        return constant;
    }
}
