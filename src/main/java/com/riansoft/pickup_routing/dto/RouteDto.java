package com.riansoft.pickup_routing.dto;

import java.util.List;

public class RouteDto {
    private int routeNumber;
    private List<StopDto> stops;
    private double routeTime;
    private double routeDistance;
    private double routeCost;

    public RouteDto() {}

    public RouteDto(int routeNumber, List<StopDto> stops, double routeTime, double routeDistance, double routeCost) {
        this.routeNumber = routeNumber;
        this.stops = stops;
        this.routeTime = routeTime;
        this.routeDistance = routeDistance;
        this.routeCost = routeCost;
    }

    // --- Getters and Setters ---
    public int getRouteNumber() { return routeNumber; }
    public void setRouteNumber(int routeNumber) { this.routeNumber = routeNumber; }
    public List<StopDto> getStops() { return stops; }
    public void setStops(List<StopDto> stops) { this.stops = stops; }
    public double getRouteTime() { return routeTime; }
    public void setRouteTime(double routeTime) { this.routeTime = routeTime; }
    public double getRouteDistance() { return routeDistance; }
    public void setRouteDistance(double routeDistance) { this.routeDistance = routeDistance; }
    public double getRouteCost() { return routeCost; }
    public void setRouteCost(double routeCost) { this.routeCost = routeCost; }
}
