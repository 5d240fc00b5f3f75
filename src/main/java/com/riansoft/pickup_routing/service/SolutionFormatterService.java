package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.dto.DirectShipmentDto;
import com.riansoft.pickup_routing.dto.RouteDto;
import com.riansoft.pickup_routing.dto.RouteSolutionDto;
import com.riansoft.pickup_routing.dto.StopDto;
import com.riansoft.pickup_routing.model.OptimizationResult;
import com.riansoft.pickup_routing.model.PlannedRoute;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 최적화 결과를 응답 DTO 로 옮깁니다. 숫자는 서식 없이 그대로 전달합니다.
 */
@Service
public class SolutionFormatterService {

    public RouteSolutionDto formatSolutionToDto(OptimizationResult result) {
        List<RouteDto> routes = result.routes.stream()
                .map(this::toRouteDto)
                .collect(Collectors.toList());
        List<DirectShipmentDto> directShipments = result.directShipments.stream()
                .map(d -> new DirectShipmentDto(d.locationId, d.name, d.cost))
                .collect(Collectors.toList());
        return new RouteSolutionDto(result.status.name(), routes, directShipments,
                result.directShipmentCost, result.routingCost, result.totalCost());
    }

    private RouteDto toRouteDto(PlannedRoute route) {
        List<StopDto> stops = route.stops.stream()
                .map(s -> new StopDto(s.locationId, s.name, s.cumulativeTime, s.cumulativeDistance, s.cumulativeCost))
                .collect(Collectors.toList());
        return new RouteDto(route.routeNumber, stops, route.totalTime(), route.totalDistance(), route.totalCost());
    }
}
