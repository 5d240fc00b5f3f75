package com.riansoft.pickup_routing.dto;

// 구간 테이블의 한 행. directed 가 아니면 반대 방향이 없을 때 같은 값으로 채웁니다.
public class EdgeRowDto {
    private String from;
    private String to;
    private Double drivingTimeMinutes;
    private Double distanceMiles;
    private Boolean directed;

    public EdgeRowDto() {}

    public EdgeRowDto(String from, String to, Double drivingTimeMinutes) {
        this.from = from;
        this.to = to;
        this.drivingTimeMinutes = drivingTimeMinutes;
    }

    // --- Getters and Setters ---
    public String getFrom() { return from; }
    public void setFrom(String from) { this.from = from; }
    public String getTo() { return to; }
    public void setTo(String to) { this.to = to; }
    public Double getDrivingTimeMinutes() { return drivingTimeMinutes; }
    public void setDrivingTimeMinutes(Double drivingTimeMinutes) { this.drivingTimeMinutes = drivingTimeMinutes; }
    public Double getDistanceMiles() { return distanceMiles; }
    public void setDistanceMiles(Double distanceMiles) { this.distanceMiles = distanceMiles; }
    public Boolean getDirected() { return directed; }
    public void setDirected(Boolean directed) { this.directed = directed; }
}
