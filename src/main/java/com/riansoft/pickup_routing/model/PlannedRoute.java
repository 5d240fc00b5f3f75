package com.riansoft.pickup_routing.model;

import java.util.List;
import java.util.stream.Collectors;

public class PlannedRoute {
    public final int routeNumber;
    public final List<RouteStop> stops;

    public PlannedRoute(int routeNumber, List<RouteStop> stops) {
        this.routeNumber = routeNumber;
        this.stops = List.copyOf(stops);
    }

    public double totalTime() {
        return last().cumulativeTime;
    }

    public double totalDistance() {
        return last().cumulativeDistance;
    }

    public double totalCost() {
        return last().cumulativeCost;
    }

    public List<String> locationIds() {
        return stops.stream().map(stop -> stop.locationId).collect(Collectors.toList());
    }

    /** 출발/도착 지점을 제외하고 실제로 방문하는 지점들입니다. */
    public List<String> visitedLocationIds() {
        return locationIds().subList(1, stops.size() - 1);
    }

    private RouteStop last() {
        return stops.get(stops.size() - 1);
    }

    @Override
    public String toString() {
        return "Route#" + routeNumber + " " + String.join(" -> ", locationIds());
    }
}
