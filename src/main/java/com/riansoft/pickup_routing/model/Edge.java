package com.riansoft.pickup_routing.model;

/**
 * 두 지점 사이의 방향성 있는 이동 구간입니다. 시간은 분, 거리는 마일 단위입니다.
 */
public class Edge {
    public final String from;
    public final String to;
    public final double time;
    public final double distance;
    public final boolean hasDistance;

    public Edge(String from, String to, double time, double distance) {
        this.from = from;
        this.to = to;
        this.time = time;
        this.distance = distance;
        this.hasDistance = true;
    }

    public Edge(String from, String to, double time) {
        this.from = from;
        this.to = to;
        this.time = time;
        this.distance = 0;
        this.hasDistance = false;
    }

    public Edge mirrored() {
        return hasDistance ? new Edge(to, from, time, distance) : new Edge(to, from, time);
    }

    @Override
    public String toString() {
        return from + "->" + to + " (" + time + "분)";
    }
}
