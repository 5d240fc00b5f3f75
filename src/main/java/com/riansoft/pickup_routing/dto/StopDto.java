package com.riansoft.pickup_routing.dto;

public class StopDto {
    private String id;
    private String name;
    private double cumulativeTime;
    private double cumulativeDistance;
    private double cumulativeCost;

    // 1. 기본 생성자
    public StopDto() {}

    // 2. SolutionFormatterService 에서 경로 데이터를 담을 때 사용하는 생성자
    public StopDto(String id, String name, double cumulativeTime, double cumulativeDistance, double cumulativeCost) {
        this.id = id;
        this.name = name;
        this.cumulativeTime = cumulativeTime;
        this.cumulativeDistance = cumulativeDistance;
        this.cumulativeCost = cumulativeCost;
    }

    // --- Getters and Setters ---
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public double getCumulativeTime() { return cumulativeTime; }
    public void setCumulativeTime(double cumulativeTime) { this.cumulativeTime = cumulativeTime; }
    public double getCumulativeDistance() { return cumulativeDistance; }
    public void setCumulativeDistance(double cumulativeDistance) { this.cumulativeDistance = cumulativeDistance; }
    public double getCumulativeCost() { return cumulativeCost; }
    public void setCumulativeCost(double cumulativeCost) { this.cumulativeCost = cumulativeCost; }
}
