package com.riansoft.pickup_routing.model;

public class DirectShipment {
    public final String locationId;
    public final String name;
    public final double cost;

    public DirectShipment(String locationId, String name, double cost) {
        this.locationId = locationId;
        this.name = name;
        this.cost = cost;
    }
}
