package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.RoutingFixtures;
import com.riansoft.pickup_routing.exception.ReconstructionException;
import com.riansoft.pickup_routing.model.Edge;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.OptimizationResult;
import com.riansoft.pickup_routing.model.PlannedRoute;
import com.riansoft.pickup_routing.model.RouteStop;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.solver.MilpVariable;
import com.riansoft.pickup_routing.solver.SolverOutcome;
import com.riansoft.pickup_routing.solver.SolverStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SolutionExtractorTest {

    private final RouteModelBuilder builder = new RouteModelBuilder();
    private final SolutionExtractor extractor = new SolutionExtractor(new ObjectiveComposer());

    /** 이름으로 지정한 변수만 1, 나머지는 0 인 solver 결과를 만듭니다. */
    private static SolverOutcome selecting(RouteModel model, String... selectedNames) {
        List<MilpVariable> variables = model.milp.getVariables();
        double[] values = new double[variables.size()];
        for (String name : selectedNames) {
            MilpVariable variable = variables.stream()
                    .filter(v -> v.name.equals(name))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("변수 없음: " + name));
            values[variable.index] = 1;
        }
        return new SolverOutcome(SolverStatus.OPTIMAL, values, 0, 5);
    }

    private RouteModel scenarioModel(double budget) {
        return builder.build(RoutingFixtures.scenarioGraph(), RoutingFixtures.flatConfig(budget, 1, 2));
    }

    @Test
    @DisplayName("선택된 구간을 따라 누적 시간/거리/비용이 있는 경로를 복원한다")
    void reconstructsClosedTour() {
        RouteModel model = scenarioModel(60);

        OptimizationResult result = extractor.extract(model,
                selecting(model, "arc[H,A,1]", "arc[A,B,1]", "arc[B,H,1]"));

        assertEquals(SolverStatus.OPTIMAL, result.status);
        assertTrue(result.directShipments.isEmpty());
        assertEquals(1, result.routes.size());

        PlannedRoute route = result.routes.get(0);
        assertEquals(1, route.routeNumber);
        assertEquals(List.of("H", "A", "B", "H"), route.locationIds());
        assertEquals(List.of("A", "B"), route.visitedLocationIds());

        List<RouteStop> stops = route.stops;
        assertEquals(0, stops.get(0).cumulativeTime);
        assertEquals(20, stops.get(1).cumulativeTime);
        assertEquals(35, stops.get(2).cumulativeTime);
        assertEquals(60, stops.get(3).cumulativeTime);
        assertEquals(40, stops.get(1).cumulativeCost);
        assertEquals(70, stops.get(2).cumulativeCost);
        assertEquals(120, stops.get(3).cumulativeCost);
        assertEquals(30, route.totalDistance());

        assertEquals(0, result.directShipmentCost);
        assertEquals(120, result.routingCost);
        assertEquals(120, result.totalCost());
    }

    @Test
    @DisplayName("직배송만 선택되면 경로 없이 직배송 비용만 남는다")
    void allDirect() {
        RouteModel model = scenarioModel(60);

        OptimizationResult result = extractor.extract(model, selecting(model, "direct[A]", "direct[B]"));

        assertTrue(result.routes.isEmpty());
        assertEquals(2, result.directShipments.size());
        assertEquals(250, result.totalCost());
    }

    @Test
    @DisplayName("비어 있는 경로 번호를 건너뛰고 사용된 경로만 1부터 다시 번호를 매긴다")
    void renumbersUsedRoutes() {
        RouteModel model = builder.build(RoutingFixtures.scenarioGraph(), RoutingFixtures.flatConfig(60, 2, 1));

        OptimizationResult result = extractor.extract(model,
                selecting(model, "direct[B]", "arc[H,A,2]", "arc[A,H,2]"));

        assertEquals(1, result.routes.size());
        assertEquals(1, result.routes.get(0).routeNumber);
        assertEquals(List.of("H", "A", "H"), result.routes.get(0).locationIds());
        assertEquals(150 + 40, result.totalCost());
    }

    @Test
    @DisplayName("출발 지점과 분리된 순환이 있으면 ReconstructionException")
    void detectsDisjointCycle() {
        List<Edge> edges = new ArrayList<>();
        RoutingFixtures.addBoth(edges, "H", "A", 10);
        RoutingFixtures.addBoth(edges, "H", "B", 10);
        RoutingFixtures.addBoth(edges, "H", "C", 10);
        RoutingFixtures.addBoth(edges, "A", "B", 10);
        RoutingFixtures.addBoth(edges, "A", "C", 10);
        RoutingFixtures.addBoth(edges, "B", "C", 10);
        LocationGraph graph = LocationGraph.construct(List.of(Location.hub("H"),
                Location.depot("A", 50), Location.depot("B", 50), Location.depot("C", 50)), edges);
        RouteModel model = builder.build(graph, RoutingConfig.builder().maxDriveTimeMinutes(100).build());

        SolverOutcome outcome = selecting(model, "arc[H,A,1]", "arc[A,H,1]", "arc[B,C,1]", "arc[C,B,1]");

        ReconstructionException e = assertThrows(ReconstructionException.class, () -> extractor.extract(model, outcome));
        assertTrue(e.getMessage().contains("순환"));
    }

    @Test
    @DisplayName("직배송과 경로에 동시에 포함된 지점은 ReconstructionException")
    void detectsDoubleAssignment() {
        RouteModel model = scenarioModel(60);
        SolverOutcome outcome = selecting(model, "direct[A]", "arc[H,A,1]", "arc[A,B,1]", "arc[B,H,1]");

        assertThrows(ReconstructionException.class, () -> extractor.extract(model, outcome));
    }

    @Test
    @DisplayName("어디에도 배정되지 않은 지점은 ReconstructionException")
    void detectsUncoveredLocation() {
        RouteModel model = scenarioModel(60);
        SolverOutcome outcome = selecting(model, "direct[A]");

        ReconstructionException e = assertThrows(ReconstructionException.class, () -> extractor.extract(model, outcome));
        assertTrue(e.getMessage().contains("'B'"));
    }

    @Test
    @DisplayName("한 지점에서 두 구간이 나가거나 경로가 끊기면 ReconstructionException")
    void detectsMalformedPaths() {
        RouteModel model = scenarioModel(60);

        assertThrows(ReconstructionException.class,
                () -> extractor.extract(model, selecting(model, "arc[H,A,1]", "arc[H,B,1]")));
        assertThrows(ReconstructionException.class,
                () -> extractor.extract(model, selecting(model, "direct[B]", "arc[H,A,1]")));
        assertThrows(ReconstructionException.class,
                () -> extractor.extract(model, selecting(model, "direct[A]", "direct[B]", "arc[A,B,1]", "arc[B,A,1]")));
    }

    @Test
    @DisplayName("운행 시간 제한을 넘는 경로는 ReconstructionException")
    void detectsBudgetViolation() {
        RouteModel model = scenarioModel(59);
        SolverOutcome outcome = selecting(model, "arc[H,A,1]", "arc[A,B,1]", "arc[B,H,1]");

        assertThrows(ReconstructionException.class, () -> extractor.extract(model, outcome));
    }

    @Test
    @DisplayName("출발 depot 은 경로가 없으면 직배송으로, 경로가 있으면 경로의 시작점으로 배정된다")
    void anchorDepotIsDirectOnlyWithoutRoutes() {
        RouteModel model = builder.build(RoutingFixtures.scenarioGraph(),
                RoutingConfig.builder().maxDriveTimeMinutes(60).start("A").build());

        OptimizationResult allDirect = extractor.extract(model, selecting(model, "direct[A]", "direct[B]"));
        assertTrue(allDirect.routes.isEmpty());
        assertEquals(250, allDirect.totalCost());

        OptimizationResult routed = extractor.extract(model, selecting(model, "arc[A,B,1]", "arc[B,H,1]"));
        assertTrue(routed.directShipments.isEmpty());
        assertEquals(List.of("A", "B", "H"), routed.routes.get(0).locationIds());
    }

    @Test
    @DisplayName("출발 depot 이 직배송에도 경로에도 없거나 둘 다에 있으면 ReconstructionException")
    void detectsUnservedOrDoubleServedAnchor() {
        RouteModel model = builder.build(RoutingFixtures.scenarioGraph(),
                RoutingConfig.builder().maxDriveTimeMinutes(60).start("A").build());

        ReconstructionException unserved = assertThrows(ReconstructionException.class,
                () -> extractor.extract(model, selecting(model, "direct[B]")));
        assertTrue(unserved.getMessage().contains("'A'"));

        assertThrows(ReconstructionException.class,
                () -> extractor.extract(model, selecting(model, "direct[A]", "arc[A,B,1]", "arc[B,H,1]")));
    }

    @Test
    @DisplayName("해가 없는 결과는 복원할 수 없다")
    void rejectsOutcomeWithoutSolution() {
        RouteModel model = scenarioModel(60);

        assertThrows(IllegalArgumentException.class,
                () -> extractor.extract(model, SolverOutcome.timedOutWithoutSolution(10)));
    }
}
