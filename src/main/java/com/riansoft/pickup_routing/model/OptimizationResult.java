package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.solver.SolverStatus;

import java.util.List;

/**
 * 한 번의 실행 결과입니다. 생성 이후에는 변경되지 않습니다.
 */
public class OptimizationResult {
    public final SolverStatus status;
    public final List<DirectShipment> directShipments;
    public final List<PlannedRoute> routes;
    public final double directShipmentCost;
    public final double routingCost;
    public final double objectiveValue;

    public OptimizationResult(SolverStatus status, List<DirectShipment> directShipments, List<PlannedRoute> routes,
                              double objectiveValue) {
        this.status = status;
        this.directShipments = List.copyOf(directShipments);
        this.routes = List.copyOf(routes);
        this.directShipmentCost = directShipments.stream().mapToDouble(d -> d.cost).sum();
        this.routingCost = routes.stream().mapToDouble(PlannedRoute::totalCost).sum();
        this.objectiveValue = objectiveValue;
    }

    public double totalCost() {
        return directShipmentCost + routingCost;
    }

    public boolean isOptimal() {
        return status == SolverStatus.OPTIMAL;
    }
}
