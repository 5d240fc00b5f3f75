package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.model.CostModel;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.solver.LinearExpression;
import com.riansoft.pickup_routing.solver.MilpVariable;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 비용 계수로 최소화할 선형 목적 함수를 만듭니다.
 * 직배송 비용의 합 + 선택된 구간들의 운행 비용의 합입니다.
 */
@Service
public class ObjectiveComposer {

    private static final double MINUTES_PER_HOUR = 60.0;

    public LinearExpression compose(RouteModel model) {
        LinearExpression objective = new LinearExpression();
        for (Map.Entry<String, MilpVariable> entry : model.directShipVariables().entrySet()) {
            Location location = model.graph.location(entry.getKey());
            if (location.directShipCost != 0) {
                objective.plus(entry.getValue(), location.directShipCost);
            }
        }
        CostModel costModel = model.config.costModel;
        for (int r = 0; r < model.routeCount; r++) {
            for (RouteModel.Arc arc : model.arcs(r)) {
                double cost = arcCost(model.graph, costModel, arc.from, arc.to);
                if (cost != 0) {
                    objective.plus(arc.variable, cost);
                }
            }
        }
        return objective;
    }

    /** 목적 함수를 모델에 설정합니다. */
    public void apply(RouteModel model) {
        model.milp.minimize(compose(model));
    }

    /**
     * from -> to 구간 하나를 운행하는 비용.
     * FLAT: 분당 비용 * 시간, ITEMIZED: 마일당 유류비 * 거리 + 시간당 인건비 * 시간 / 60.
     */
    public double arcCost(LocationGraph graph, CostModel costModel, String from, String to) {
        double time = graph.time(from, to);
        if (costModel.type == CostModel.Type.FLAT) {
            return costModel.flatRouteCostPerMinute * time;
        }
        return costModel.gasCostPerMile * graph.distance(from, to)
                + costModel.staffCostPerHour * time / MINUTES_PER_HOUR;
    }
}
