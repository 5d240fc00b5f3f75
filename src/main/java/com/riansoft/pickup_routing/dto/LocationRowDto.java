package com.riansoft.pickup_routing.dto;

// 지점 테이블의 한 행 (수집 단계에서 이미 검증된 값)
public class LocationRowDto {
    private String id;
    private String name;
    private Boolean included;
    private Boolean hub;
    private Double directShipmentCost;
    private String fixedDecision;

    public LocationRowDto() {}

    public LocationRowDto(String id, Boolean hub, Double directShipmentCost) {
        this.id = id;
        this.hub = hub;
        this.directShipmentCost = directShipmentCost;
    }

    // --- Getters and Setters ---
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Boolean getIncluded() { return included; }
    public void setIncluded(Boolean included) { this.included = included; }
    public Boolean getHub() { return hub; }
    public void setHub(Boolean hub) { this.hub = hub; }
    public Double getDirectShipmentCost() { return directShipmentCost; }
    public void setDirectShipmentCost(Double directShipmentCost) { this.directShipmentCost = directShipmentCost; }
    public String getFixedDecision() { return fixedDecision; }
    public void setFixedDecision(String fixedDecision) { this.fixedDecision = fixedDecision; }
}
