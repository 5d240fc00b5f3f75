package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.RoutingFixtures;
import com.riansoft.pickup_routing.model.CostModel;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.solver.LinearExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ObjectiveComposerTest {

    private final RouteModelBuilder builder = new RouteModelBuilder();
    private final ObjectiveComposer composer = new ObjectiveComposer();

    @Test
    @DisplayName("FLAT: 직배송 비용 + 분당 비용 * 이동 시간")
    void flatCoefficients() {
        RouteModel model = builder.build(RoutingFixtures.scenarioGraph(), RoutingFixtures.flatConfig(60, 1, 2));

        LinearExpression objective = composer.compose(model);

        assertEquals(100, objective.coefficient(model.directShip("A")));
        assertEquals(150, objective.coefficient(model.directShip("B")));
        assertEquals(40, objective.coefficient(model.arc(0, "H", "A").variable));
        assertEquals(30, objective.coefficient(model.arc(0, "A", "B").variable));
        assertEquals(50, objective.coefficient(model.arc(0, "B", "H").variable));
        assertEquals(0, objective.coefficient(model.position(0, "A")));
    }

    @Test
    @DisplayName("ITEMIZED: 마일당 유류비 * 거리 + 시간당 인건비 * 시간 / 60")
    void itemizedCoefficients() {
        LocationGraph graph = RoutingFixtures.scenarioGraph();
        RoutingConfig config = RoutingConfig.builder().maxDriveTimeMinutes(60)
                .costModel(CostModel.itemized(0.5, 30)).build();
        RouteModel model = builder.build(graph, config);

        LinearExpression objective = composer.compose(model);

        // H->A: 0.5 * 10 + 30 * 20 / 60 = 15
        assertEquals(15, objective.coefficient(model.arc(0, "H", "A").variable), 1e-9);
        assertEquals(15, composer.arcCost(graph, config.costModel, "A", "H"), 1e-9);
        // A->B: 0.5 * 8 + 30 * 15 / 60 = 11.5
        assertEquals(11.5, composer.arcCost(graph, config.costModel, "A", "B"), 1e-9);
        assertEquals(100, objective.coefficient(model.directShip("A")));
    }

    @Test
    @DisplayName("apply 는 모델에 목적 함수를 설정한다")
    void applySetsObjective() {
        RouteModel model = builder.build(RoutingFixtures.scenarioGraph(), RoutingFixtures.flatConfig(60, 2, 1));
        assertFalse(model.milp.hasObjective());

        composer.apply(model);

        assertTrue(model.milp.hasObjective());
        assertEquals(25, model.milp.getObjective().coefficient(model.arc(1, "H", "B").variable));
    }
}
