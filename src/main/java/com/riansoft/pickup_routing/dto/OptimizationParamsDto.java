package com.riansoft.pickup_routing.dto;

// 최적화 파라미터. 비어 있는 값은 application.properties 의 기본값을 사용합니다.
public class OptimizationParamsDto {
    private Double maxDrivingTimeMinutes;
    private Double maxDrivingTimeHours;
    private Integer maxRoutes;
    private String costModel;
    private Double flatRouteCostPerMinute;
    private Double gasCostPerMile;
    private Double staffCostPerHour;
    private String startLocationId;
    private String endLocationId;
    private Long timeLimitSeconds;

    // --- Getters and Setters ---
    public Double getMaxDrivingTimeMinutes() { return maxDrivingTimeMinutes; }
    public void setMaxDrivingTimeMinutes(Double maxDrivingTimeMinutes) { this.maxDrivingTimeMinutes = maxDrivingTimeMinutes; }
    public Double getMaxDrivingTimeHours() { return maxDrivingTimeHours; }
    public void setMaxDrivingTimeHours(Double maxDrivingTimeHours) { this.maxDrivingTimeHours = maxDrivingTimeHours; }
    public Integer getMaxRoutes() { return maxRoutes; }
    public void setMaxRoutes(Integer maxRoutes) { this.maxRoutes = maxRoutes; }
    public String getCostModel() { return costModel; }
    public void setCostModel(String costModel) { this.costModel = costModel; }
    public Double getFlatRouteCostPerMinute() { return flatRouteCostPerMinute; }
    public void setFlatRouteCostPerMinute(Double flatRouteCostPerMinute) { this.flatRouteCostPerMinute = flatRouteCostPerMinute; }
    public Double getGasCostPerMile() { return gasCostPerMile; }
    public void setGasCostPerMile(Double gasCostPerMile) { this.gasCostPerMile = gasCostPerMile; }
    public Double getStaffCostPerHour() { return staffCostPerHour; }
    public void setStaffCostPerHour(Double staffCostPerHour) { this.staffCostPerHour = staffCostPerHour; }
    public String getStartLocationId() { return startLocationId; }
    public void setStartLocationId(String startLocationId) { this.startLocationId = startLocationId; }
    public String getEndLocationId() { return endLocationId; }
    public void setEndLocationId(String endLocationId) { this.endLocationId = endLocationId; }
    public Long getTimeLimitSeconds() { return timeLimitSeconds; }
    public void setTimeLimitSeconds(Long timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
}
