package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.exception.ReconstructionException;
import com.riansoft.pickup_routing.model.CostModel;
import com.riansoft.pickup_routing.model.DirectShipment;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.OptimizationResult;
import com.riansoft.pickup_routing.model.PlannedRoute;
import com.riansoft.pickup_routing.model.RouteStop;
import com.riansoft.pickup_routing.solver.MilpVariable;
import com.riansoft.pickup_routing.solver.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * solver 의 원시 배정을 직배송 목록, 순서가 있는 경로, 비용 합계로 바꿉니다.
 * 선택된 구간이 출발 -> 도착의 단일 단순 경로를 이루지 않으면 {@link ReconstructionException} 을 던집니다.
 */
@Service
public class SolutionExtractor {

    private static final Logger log = LoggerFactory.getLogger(SolutionExtractor.class);
    private static final double BUDGET_TOLERANCE = 1e-6;

    private final ObjectiveComposer objectiveComposer;

    @Autowired
    public SolutionExtractor(ObjectiveComposer objectiveComposer) {
        this.objectiveComposer = objectiveComposer;
    }

    public OptimizationResult extract(RouteModel model, SolverOutcome outcome) {
        if (!outcome.hasSolution()) {
            throw new IllegalArgumentException("해가 없는 solver 결과에서는 경로를 복원할 수 없습니다. (status=" + outcome.status + ")");
        }

        // 1. 직배송 지점
        List<DirectShipment> directShipments = new ArrayList<>();
        Set<String> directIds = new HashSet<>();
        for (Map.Entry<String, MilpVariable> entry : model.directShipVariables().entrySet()) {
            if (!outcome.isSelected(entry.getValue())) continue;
            String id = entry.getKey();
            Location location = model.graph.location(id);
            directShipments.add(new DirectShipment(id, location.name, location.directShipCost));
            directIds.add(id);
        }

        // 2. 경로 복원
        List<PlannedRoute> routes = new ArrayList<>();
        Set<String> routedIds = new HashSet<>();
        for (int r = 0; r < model.routeCount; r++) {
            Map<String, String> successors = selectedSuccessors(model, outcome, r);
            if (successors.isEmpty()) continue;
            List<RouteStop> stops = followRoute(model, successors, r, directIds, routedIds);
            PlannedRoute route = new PlannedRoute(routes.size() + 1, stops);
            if (route.totalTime() > model.config.maxDriveTimeMinutes + BUDGET_TOLERANCE * Math.max(1.0, model.config.maxDriveTimeMinutes)) {
                throw new ReconstructionException("경로 " + (r + 1) + "의 운행 시간 " + route.totalTime()
                        + "분이 제한 " + model.config.maxDriveTimeMinutes + "분을 초과합니다.");
            }
            routes.add(route);
        }

        // 3. 모든 대상 지점이 직배송 또는 경로 중 정확히 하나에 속하는지 확인
        for (String customer : model.customers) {
            if (!directIds.contains(customer) && !routedIds.contains(customer)) {
                throw new ReconstructionException("지점 '" + customer + "'이 직배송에도, 어떤 경로에도 포함되지 않았습니다.");
            }
        }
        // 출발/도착 depot 은 경로가 있으면 경로의 끝점, 없으면 직배송
        for (String anchor : model.anchors) {
            if (model.graph.location(anchor).isHub()) continue;
            boolean direct = directIds.contains(anchor);
            if (direct && !routes.isEmpty()) {
                throw new ReconstructionException("출발/도착 지점 '" + anchor + "'이 직배송과 경로에 동시에 포함되었습니다.");
            }
            if (!direct && routes.isEmpty()) {
                throw new ReconstructionException("출발/도착 지점 '" + anchor + "'이 직배송에도, 어떤 경로에도 포함되지 않았습니다.");
            }
        }

        OptimizationResult result = new OptimizationResult(outcome.status, directShipments, routes, outcome.objectiveValue);
        log.info("[EXTRACT] 직배송 {}곳, 경로 {}개, 총 비용 {}", directShipments.size(), routes.size(), result.totalCost());
        return result;
    }

    private Map<String, String> selectedSuccessors(RouteModel model, SolverOutcome outcome, int route) {
        Map<String, String> successors = new LinkedHashMap<>();
        for (RouteModel.Arc arc : model.arcs(route)) {
            if (!outcome.isSelected(arc.variable)) continue;
            String previous = successors.put(arc.from, arc.to);
            if (previous != null) {
                throw new ReconstructionException("경로 " + (route + 1) + "에서 지점 '" + arc.from
                        + "'이 두 개의 다음 지점('" + previous + "', '" + arc.to + "')을 가집니다.");
            }
        }
        return successors;
    }

    /**
     * 출발 지점부터 선택된 구간을 따라 도착 지점까지 이동합니다.
     * 방문 집합으로 예상치 못한 순환을 감지해 무한 루프 대신 예외로 바꿉니다.
     */
    private List<RouteStop> followRoute(RouteModel model, Map<String, String> successors, int route,
                                        Set<String> directIds, Set<String> routedIds) {
        LocationGraph graph = model.graph;
        CostModel costModel = model.config.costModel;
        int routeNumber = route + 1;

        if (!successors.containsKey(model.startId)) {
            throw new ReconstructionException("경로 " + routeNumber + "의 선택된 구간이 출발 지점 '"
                    + model.startId + "'과 연결되지 않습니다.");
        }

        List<RouteStop> stops = new ArrayList<>();
        stops.add(new RouteStop(model.startId, graph.location(model.startId).name, 0, 0, 0));

        Set<String> visited = new HashSet<>();
        String current = model.startId;
        double time = 0;
        double distance = 0;
        double cost = 0;
        int usedArcs = 0;
        while (true) {
            String next = successors.get(current);
            if (next == null) {
                throw new ReconstructionException("경로 " + routeNumber + "이 도착 지점 '" + model.endId
                        + "'에 닿기 전에 '" + current + "'에서 끊어졌습니다.");
            }
            usedArcs++;
            time += graph.time(current, next);
            distance += graph.distance(current, next);
            cost += objectiveComposer.arcCost(graph, costModel, current, next);
            stops.add(new RouteStop(next, graph.location(next).name, time, distance, cost));

            if (next.equals(model.endId)) break;
            if (model.isAnchor(next)) {
                throw new ReconstructionException("경로 " + routeNumber + "이 중간에 출발 지점 '" + next + "'을 다시 지납니다.");
            }
            if (!visited.add(next)) {
                throw new ReconstructionException("경로 " + routeNumber + "에서 지점 '" + next + "'을 두 번 방문합니다.");
            }
            if (!routedIds.add(next)) {
                throw new ReconstructionException("지점 '" + next + "'이 둘 이상의 경로에서 방문됩니다.");
            }
            if (directIds.contains(next)) {
                throw new ReconstructionException("지점 '" + next + "'이 직배송과 경로 " + routeNumber + "에 동시에 포함되었습니다.");
            }
            current = next;
        }

        if (usedArcs != successors.size()) {
            throw new ReconstructionException("경로 " + routeNumber + "에 출발 지점과 분리된 순환이 있습니다. (선택된 구간 "
                    + successors.size() + "개 중 " + usedArcs + "개만 경로에 포함)");
        }
        if (stops.size() == 2) {
            throw new ReconstructionException("경로 " + routeNumber + "이 아무 지점도 방문하지 않습니다.");
        }
        return stops;
    }
}
