package com.riansoft.pickup_routing.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 특정 solver에 묶이지 않은 혼합 정수 선형 계획(MILP) 모델입니다.
 * 모델 빌더가 변수와 제약을 추가하고, 목적 함수 구성기가 최소화할 식을 지정합니다.
 */
public class MilpModel {

    private final String name;
    private final List<MilpVariable> variables = new ArrayList<>();
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private final Set<String> variableNames = new HashSet<>();
    private LinearExpression objective;

    public MilpModel(String name) {
        this.name = name;
    }

    public MilpVariable addBinary(String variableName) {
        return addVariable(variableName, MilpVariable.Kind.BINARY, 0, 1);
    }

    public MilpVariable addInteger(String variableName, double lowerBound, double upperBound) {
        return addVariable(variableName, MilpVariable.Kind.INTEGER, lowerBound, upperBound);
    }

    private MilpVariable addVariable(String variableName, MilpVariable.Kind kind, double lowerBound, double upperBound) {
        if (!variableNames.add(variableName)) {
            throw new IllegalStateException("변수 이름이 중복되었습니다: " + variableName);
        }
        if (lowerBound > upperBound) {
            throw new IllegalStateException("변수 " + variableName + "의 하한이 상한보다 큽니다.");
        }
        MilpVariable variable = new MilpVariable(variables.size(), variableName, kind, lowerBound, upperBound);
        variables.add(variable);
        return variable;
    }

    public LinearConstraint add(LinearConstraint constraint) {
        for (MilpVariable variable : constraint.expression.terms().keySet()) {
            if (variable.index >= variables.size() || variables.get(variable.index) != variable) {
                throw new IllegalStateException("제약 " + constraint.name + "이 다른 모델의 변수 " + variable + "를 참조합니다.");
            }
        }
        constraints.add(constraint);
        return constraint;
    }

    public void minimize(LinearExpression expression) {
        this.objective = expression;
    }

    public String getName() {
        return name;
    }

    public List<MilpVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Optional<LinearConstraint> findConstraint(String constraintName) {
        return constraints.stream().filter(c -> c.name.equals(constraintName)).findFirst();
    }

    public LinearExpression getObjective() {
        return objective;
    }

    public boolean hasObjective() {
        return objective != null;
    }
}
