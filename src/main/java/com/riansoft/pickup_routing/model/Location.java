package com.riansoft.pickup_routing.model;

public class Location {
    public final String id;
    public final String name;
    public final LocationRole role;
    public final double directShipCost;
    public final FixedDecision fixedDecision;

    public Location(String id, String name, LocationRole role, double directShipCost, FixedDecision fixedDecision) {
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.role = role;
        this.directShipCost = directShipCost;
        this.fixedDecision = fixedDecision == null ? FixedDecision.UNCONSTRAINED : fixedDecision;
    }

    public static Location hub(String id) {
        return new Location(id, id, LocationRole.HUB, 0, FixedDecision.UNCONSTRAINED);
    }

    public static Location depot(String id, double directShipCost) {
        return new Location(id, id, LocationRole.DEPOT, directShipCost, FixedDecision.UNCONSTRAINED);
    }

    public static Location depot(String id, double directShipCost, FixedDecision fixedDecision) {
        return new Location(id, id, LocationRole.DEPOT, directShipCost, fixedDecision);
    }

    public boolean isHub() {
        return role == LocationRole.HUB;
    }

    @Override
    public String toString() {
        return id + "(" + role + ")";
    }
}
