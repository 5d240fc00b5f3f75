package com.riansoft.pickup_routing.model;

/**
 * 경로 위의 한 정차 지점과, 출발 지점부터 이 지점까지의 누적 시간/거리/비용입니다.
 */
public class RouteStop {
    public final String locationId;
    public final String name;
    public final double cumulativeTime;
    public final double cumulativeDistance;
    public final double cumulativeCost;

    public RouteStop(String locationId, String name, double cumulativeTime, double cumulativeDistance, double cumulativeCost) {
        this.locationId = locationId;
        this.name = name;
        this.cumulativeTime = cumulativeTime;
        this.cumulativeDistance = cumulativeDistance;
        this.cumulativeCost = cumulativeCost;
    }
}
