package com.riansoft.pickup_routing.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.riansoft.pickup_routing.exception.SolverFailureException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Google OR-Tools 의 MPSolver(기본 SCIP 백엔드)로 {@link MilpModel} 을 풉니다.
 */
@Service
public class OrToolsMilpSolver implements MilpSolver {

    private static final Logger log = LoggerFactory.getLogger(OrToolsMilpSolver.class);

    private static volatile boolean nativeLibrariesLoaded = false;

    private final String backend;
    private final Set<MPSolver> runningSolvers = ConcurrentHashMap.newKeySet();

    public OrToolsMilpSolver(@Value("${routing.solver.backend:SCIP}") String backend) {
        this.backend = backend;
    }

    @PostConstruct
    public void init() {
        loadNativeLibraries();
    }

    static synchronized void loadNativeLibraries() {
        if (nativeLibrariesLoaded) return;
        log.info("[LOG] Google OR-Tools 네이티브 라이브러리 로드를 시도합니다...");
        try {
            Loader.loadNativeLibraries();
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            throw new SolverFailureException("OR-Tools 네이티브 라이브러리를 불러오지 못했습니다.", e);
        }
        nativeLibrariesLoaded = true;
        log.info("[LOG] 라이브러리 로드 성공!");
    }

    @Override
    public SolverOutcome solve(MilpModel model, SolveOptions options) {
        if (!model.hasObjective()) {
            throw new SolverFailureException("목적 함수가 없는 모델은 풀 수 없습니다: " + model.getName());
        }
        loadNativeLibraries();

        MPSolver solver = MPSolver.createSolver(backend);
        if (solver == null) {
            throw new SolverFailureException("OR-Tools 에서 '" + backend + "' 백엔드를 사용할 수 없습니다.");
        }
        runningSolvers.add(solver);
        try {
            List<MPVariable> mpVariables = translateVariables(solver, model);
            translateConstraints(solver, model, mpVariables);
            translateObjective(solver, model, mpVariables);

            if (options.hasTimeLimit()) {
                solver.setTimeLimit(options.timeLimit.toMillis());
            }
            if (!solver.setNumThreads(options.numThreads)) {
                log.warn("[SOLVER] '{}' 백엔드가 스레드 수 {} 설정을 지원하지 않습니다.", backend, options.numThreads);
            }

            log.info("[SOLVER] {} 모델 계산 시작 (변수 {}개, 제약 {}개, 시간 제한 {})",
                    model.getName(), mpVariables.size(), model.getConstraints().size(),
                    options.hasTimeLimit() ? options.timeLimit.toMillis() + "ms" : "없음");
            MPSolver.ResultStatus resultStatus = solver.solve();
            long wallTime = solver.wallTime();
            log.info("[SOLVER] 계산 종료: status={}, {}ms", resultStatus, wallTime);

            switch (resultStatus) {
                case OPTIMAL:
                    return new SolverOutcome(SolverStatus.OPTIMAL, readValues(mpVariables), solver.objective().value(), wallTime);
                case FEASIBLE:
                    return new SolverOutcome(SolverStatus.TIME_LIMIT_REACHED, readValues(mpVariables), solver.objective().value(), wallTime);
                case INFEASIBLE:
                    return SolverOutcome.infeasible(wallTime);
                case NOT_SOLVED:
                    // 시간 제한이나 취소로 해를 하나도 찾지 못한 채 멈춘 경우
                    return SolverOutcome.timedOutWithoutSolution(wallTime);
                default:
                    throw new SolverFailureException("solver 가 비정상 상태로 종료되었습니다: " + resultStatus);
            }
        } finally {
            // cancel() 과 같은 잠금 안에서 해제해야 해제된 네이티브 객체에 중단 요청이 가지 않습니다.
            synchronized (solver) {
                runningSolvers.remove(solver);
                solver.delete();
            }
        }
    }

    @Override
    public void cancel() {
        for (MPSolver solver : runningSolvers) {
            synchronized (solver) {
                if (!runningSolvers.contains(solver)) continue;
                boolean interrupted = solver.interruptSolve();
                log.info("[SOLVER] 계산 중단 요청: {}", interrupted ? "수락됨" : "지원되지 않음");
            }
        }
    }

    private List<MPVariable> translateVariables(MPSolver solver, MilpModel model) {
        double infinity = MPSolver.infinity();
        List<MPVariable> mpVariables = new ArrayList<>(model.getVariables().size());
        for (MilpVariable variable : model.getVariables()) {
            double lower = clamp(variable.lowerBound, infinity);
            double upper = clamp(variable.upperBound, infinity);
            mpVariables.add(solver.makeIntVar(lower, upper, variable.name));
        }
        return mpVariables;
    }

    private void translateConstraints(MPSolver solver, MilpModel model, List<MPVariable> mpVariables) {
        double infinity = MPSolver.infinity();
        for (LinearConstraint constraint : model.getConstraints()) {
            MPConstraint mpConstraint = solver.makeConstraint(
                    clamp(constraint.lowerBound, infinity), clamp(constraint.upperBound, infinity), constraint.name);
            for (Map.Entry<MilpVariable, Double> term : constraint.expression.terms().entrySet()) {
                mpConstraint.setCoefficient(mpVariables.get(term.getKey().index), term.getValue());
            }
        }
    }

    private void translateObjective(MPSolver solver, MilpModel model, List<MPVariable> mpVariables) {
        MPObjective objective = solver.objective();
        LinearExpression expression = model.getObjective();
        for (Map.Entry<MilpVariable, Double> term : expression.terms().entrySet()) {
            objective.setCoefficient(mpVariables.get(term.getKey().index), term.getValue());
        }
        objective.setOffset(expression.constant());
        objective.setMinimization();
    }

    private double[] readValues(List<MPVariable> mpVariables) {
        double[] values = new double[mpVariables.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = mpVariables.get(i).solutionValue();
        }
        return values;
    }

    private static double clamp(double bound, double infinity) {
        if (bound == Double.POSITIVE_INFINITY) return infinity;
        if (bound == Double.NEGATIVE_INFINITY) return -infinity;
        return bound;
    }
}
