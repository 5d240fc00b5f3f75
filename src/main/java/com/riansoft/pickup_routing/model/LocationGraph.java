package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 허브와 수거 지점(depot), 그리고 모든 지점 쌍의 이동 시간/거리 행렬입니다.
 * 한 번 생성되면 실행이 끝날 때까지 변경되지 않습니다.
 */
public class LocationGraph {

    private final Map<String, Location> locations;
    private final Map<String, Map<String, Edge>> edges;
    private final Location hub;

    private LocationGraph(Map<String, Location> locations, Map<String, Map<String, Edge>> edges, Location hub) {
        this.locations = locations;
        this.edges = edges;
        this.hub = hub;
    }

    /**
     * 지점 목록과 방향성 있는 구간 목록으로 그래프를 만듭니다.
     * 서로 다른 두 지점의 모든 순서쌍에 구간이 있어야 하며, 첫 번째 위반 사항을 담은
     * {@link ValidationException}으로 실패합니다.
     */
    public static LocationGraph construct(List<Location> locationList, List<Edge> edgeList) {
        if (locationList == null || locationList.isEmpty()) {
            throw new ValidationException("지점 목록이 비어 있습니다.");
        }

        Map<String, Location> locations = new LinkedHashMap<>();
        Location hub = null;
        for (Location location : locationList) {
            if (location.id == null || location.id.isBlank()) {
                throw new ValidationException("ID가 비어 있는 지점이 있습니다.");
            }
            if (locations.containsKey(location.id)) {
                throw new ValidationException("중복된 지점 ID입니다: '" + location.id + "'");
            }
            if (!Double.isFinite(location.directShipCost) || location.directShipCost < 0) {
                throw new ValidationException("지점 '" + location.id + "'의 직배송 비용이 올바르지 않습니다: " + location.directShipCost);
            }
            if (location.isHub()) {
                if (hub != null) {
                    throw new ValidationException("허브가 두 개 이상입니다: '" + hub.id + "', '" + location.id + "'");
                }
                if (location.fixedDecision != FixedDecision.UNCONSTRAINED) {
                    throw new ValidationException("허브 '" + location.id + "'에는 고정 결정을 지정할 수 없습니다.");
                }
                hub = location;
            }
            locations.put(location.id, location);
        }
        if (hub == null) {
            throw new ValidationException("허브로 지정된 지점이 없습니다.");
        }

        Map<String, Map<String, Edge>> edges = new HashMap<>();
        for (Edge edge : edgeList == null ? List.<Edge>of() : edgeList) {
            if (!locations.containsKey(edge.from)) {
                throw new ValidationException("구간 " + edge + "의 출발 지점 '" + edge.from + "'을 찾을 수 없습니다.");
            }
            if (!locations.containsKey(edge.to)) {
                throw new ValidationException("구간 " + edge + "의 도착 지점 '" + edge.to + "'을 찾을 수 없습니다.");
            }
            if (edge.from.equals(edge.to)) {
                throw new ValidationException("자기 자신으로 가는 구간은 허용되지 않습니다: '" + edge.from + "'");
            }
            if (!Double.isFinite(edge.time) || edge.time < 0) {
                throw new ValidationException("구간 '" + edge.from + "' -> '" + edge.to + "'의 이동 시간이 올바르지 않습니다: " + edge.time);
            }
            if (edge.hasDistance && (!Double.isFinite(edge.distance) || edge.distance < 0)) {
                throw new ValidationException("구간 '" + edge.from + "' -> '" + edge.to + "'의 이동 거리가 올바르지 않습니다: " + edge.distance);
            }
            Map<String, Edge> outgoing = edges.computeIfAbsent(edge.from, k -> new HashMap<>());
            if (outgoing.containsKey(edge.to)) {
                throw new ValidationException("구간 '" + edge.from + "' -> '" + edge.to + "'이 두 번 정의되었습니다.");
            }
            outgoing.put(edge.to, edge);
        }

        for (String from : locations.keySet()) {
            for (String to : locations.keySet()) {
                if (from.equals(to)) continue;
                Map<String, Edge> outgoing = edges.get(from);
                if (outgoing == null || !outgoing.containsKey(to)) {
                    throw new ValidationException("구간 '" + from + "' -> '" + to + "'의 이동 시간이 없습니다.");
                }
            }
        }

        return new LocationGraph(Collections.unmodifiableMap(locations), edges, hub);
    }

    public Location hub() {
        return hub;
    }

    public List<Location> locations() {
        return new ArrayList<>(locations.values());
    }

    public boolean contains(String id) {
        return locations.containsKey(id);
    }

    public Location location(String id) {
        Location location = locations.get(id);
        if (location == null) {
            throw new ValidationException("지점 '" + id + "'을 찾을 수 없습니다.");
        }
        return location;
    }

    public double time(String from, String to) {
        return edge(from, to).time;
    }

    public double distance(String from, String to) {
        return edge(from, to).distance;
    }

    public boolean hasDistance(String from, String to) {
        return edge(from, to).hasDistance;
    }

    public Edge edge(String from, String to) {
        Map<String, Edge> outgoing = edges.get(from);
        Edge edge = outgoing == null ? null : outgoing.get(to);
        if (edge == null) {
            throw new ValidationException("구간 '" + from + "' -> '" + to + "'이 그래프에 없습니다.");
        }
        return edge;
    }

    public int size() {
        return locations.size();
    }
}
