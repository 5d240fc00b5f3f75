package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.exception.InfeasibleModelException;
import com.riansoft.pickup_routing.exception.SolverTimeoutException;
import com.riansoft.pickup_routing.model.FixedDecision;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.OptimizationResult;
import com.riansoft.pickup_routing.model.PlannedRoute;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.solver.MilpSolver;
import com.riansoft.pickup_routing.solver.SolveOptions;
import com.riansoft.pickup_routing.solver.SolverOutcome;
import com.riansoft.pickup_routing.solver.SolverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class RouteOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(RouteOptimizationService.class);

    private final RouteModelBuilder modelBuilder;
    private final ObjectiveComposer objectiveComposer;
    private final MilpSolver solver;
    private final SolutionExtractor solutionExtractor;
    private final long defaultTimeLimitSeconds;
    private final int solverThreads;

    @Autowired
    public RouteOptimizationService(RouteModelBuilder modelBuilder, ObjectiveComposer objectiveComposer,
                                    MilpSolver solver, SolutionExtractor solutionExtractor,
                                    @Value("${routing.solver.time-limit-seconds:60}") long defaultTimeLimitSeconds,
                                    @Value("${routing.solver.threads:1}") int solverThreads) {
        this.modelBuilder = modelBuilder;
        this.objectiveComposer = objectiveComposer;
        this.solver = solver;
        this.solutionExtractor = solutionExtractor;
        this.defaultTimeLimitSeconds = defaultTimeLimitSeconds;
        this.solverThreads = solverThreads;
    }

    /**
     * 모델 생성 -> solver 호출 -> 해 복원 순서로 한 번의 최적화를 동기적으로 실행합니다.
     * 시간 제한에 걸려도 찾은 해가 있으면 TIME_LIMIT_REACHED 상태로 결과를 돌려줍니다.
     */
    public OptimizationResult optimize(LocationGraph graph, RoutingConfig config) {
        log.info("========= [1/4] 최적화 시작: {} ==========", config);
        RouteModel routeModel = modelBuilder.build(graph, config);
        preCheckLocations(routeModel);

        log.info("========= [2/4] 목적 함수 구성 ==========");
        objectiveComposer.apply(routeModel);

        log.info("========= [3/4] solver 실행 ==========");
        SolverOutcome outcome = solver.solve(routeModel.milp, solveOptions(config));

        if (outcome.status == SolverStatus.INFEASIBLE) {
            String message = describeInfeasibility(graph, config);
            log.warn("!!! [SOLVER] 가능한 배정이 없습니다: {} !!!", message);
            throw new InfeasibleModelException(message);
        }
        if (!outcome.hasSolution()) {
            log.warn("!!! [SOLVER] 시간 제한 내에 해를 찾지 못했습니다 ({}ms) !!!", outcome.wallTimeMillis);
            throw new SolverTimeoutException("시간 제한 내에 실행 가능한 해를 찾지 못했습니다.", outcome.wallTimeMillis);
        }
        if (outcome.status == SolverStatus.TIME_LIMIT_REACHED) {
            log.warn("[SOLVER] 시간 제한에 도달했습니다. 최적이 보장되지 않는 최선의 해를 사용합니다.");
        }

        log.info("========= [4/4] 결과 복원 ==========");
        OptimizationResult result = solutionExtractor.extract(routeModel, outcome);
        for (PlannedRoute route : result.routes) {
            log.info("  {} : {}분, 비용 {}", route, route.totalTime(), route.totalCost());
        }
        log.info("[RESULT] status={}, 직배송 비용 {}, 운행 비용 {}, 총 비용 {}",
                result.status, result.directShipmentCost, result.routingCost, result.totalCost());
        return result;
    }

    /** 진행 중인 최적화에 중단을 요청합니다. 이미 찾은 해가 있으면 그 해로 결과가 만들어집니다. */
    public void cancelRunningOptimizations() {
        log.info("[SOLVER] 진행 중인 최적화 중단 요청");
        solver.cancel();
    }

    private SolveOptions solveOptions(RoutingConfig config) {
        Duration timeLimit = config.solveTimeLimit;
        if (timeLimit == null && defaultTimeLimitSeconds > 0) {
            timeLimit = Duration.ofSeconds(defaultTimeLimitSeconds);
        }
        return new SolveOptions(timeLimit, solverThreads);
    }

    /**
     * 단독 왕복만으로도 운행 시간 제한을 넘는 지점을 미리 알려 줍니다.
     * 이런 지점은 직배송 외에는 선택지가 없습니다.
     */
    private void preCheckLocations(RouteModel model) {
        if (model.customers.isEmpty()) return;
        log.info("--- [PRE-CHECK] 각 지점의 단독 왕복 시간 확인 (제한: {}분) ---", model.config.maxDriveTimeMinutes);
        boolean hasUnreachable = false;
        for (String customer : model.customers) {
            double soloTrip = model.graph.time(model.startId, customer) + model.graph.time(customer, model.endId);
            if (soloTrip > model.config.maxDriveTimeMinutes) {
                Location location = model.graph.location(customer);
                log.warn("  [WARNING] 지점 '{}'는 단독 운행만으로도 시간 제한을 초과합니다. (필요시간: {}분, 고정 결정: {})",
                        customer, soloTrip, location.fixedDecision);
                hasUnreachable = true;
            }
        }
        if (!hasUnreachable) {
            log.info("  > 모든 지점이 단독 운행 기준 시간 제한을 만족합니다.");
        }
    }

    private String describeInfeasibility(LocationGraph graph, RoutingConfig config) {
        List<String> fixed = graph.locations().stream()
                .filter(l -> l.fixedDecision != FixedDecision.UNCONSTRAINED)
                .map(l -> l.id + "=" + l.fixedDecision)
                .collect(Collectors.toList());
        return "고정 결정 " + fixed + " 과 운행 시간 제한 " + config.maxDriveTimeMinutes + "분, 최대 경로 " + config.maxRoutes
                + "개, 출발 '" + config.resolveStart(graph) + "', 도착 '" + config.resolveEnd(graph) + "'을 모두 만족하는 배정이 없습니다.";
    }
}
