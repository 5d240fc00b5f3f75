package com.riansoft.pickup_routing.dto;

import java.util.List;

public class RouteSolutionDto {

    private String status;
    private int usedRoutes;
    private List<RouteDto> routes;
    private List<DirectShipmentDto> directShipments;
    private double directShipmentCost;
    private double routingCost;
    private double totalCost;

    // 1. 기본 생성자
    public RouteSolutionDto() {}

    // 2. SolutionFormatterService 에서 최종 결과를 담을 때 사용하는 생성자
    public RouteSolutionDto(String status, List<RouteDto> routes, List<DirectShipmentDto> directShipments,
                            double directShipmentCost, double routingCost, double totalCost) {
        this.status = status;
        this.usedRoutes = routes.size();
        this.routes = routes;
        this.directShipments = directShipments;
        this.directShipmentCost = directShipmentCost;
        this.routingCost = routingCost;
        this.totalCost = totalCost;
    }

    // --- Getters and Setters ---
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public int getUsedRoutes() { return usedRoutes; }
    public void setUsedRoutes(int usedRoutes) { this.usedRoutes = usedRoutes; }
    public List<RouteDto> getRoutes() { return routes; }
    public void setRoutes(List<RouteDto> routes) { this.routes = routes; }
    public List<DirectShipmentDto> getDirectShipments() { return directShipments; }
    public void setDirectShipments(List<DirectShipmentDto> directShipments) { this.directShipments = directShipments; }
    public double getDirectShipmentCost() { return directShipmentCost; }
    public void setDirectShipmentCost(double directShipmentCost) { this.directShipmentCost = directShipmentCost; }
    public double getRoutingCost() { return routingCost; }
    public void setRoutingCost(double routingCost) { this.routingCost = routingCost; }
    public double getTotalCost() { return totalCost; }
    public void setTotalCost(double totalCost) { this.totalCost = totalCost; }
}
