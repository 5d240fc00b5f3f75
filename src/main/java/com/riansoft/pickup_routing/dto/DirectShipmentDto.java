package com.riansoft.pickup_routing.dto;

public class DirectShipmentDto {
    private String id;
    private String name;
    private double cost;

    public DirectShipmentDto() {}

    public DirectShipmentDto(String id, String name, double cost) {
        this.id = id;
        this.name = name;
        this.cost = cost;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public double getCost() { return cost; }
    public void setCost(double cost) { this.cost = cost; }
}
