package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.solver.LinearExpression;
import com.riansoft.pickup_routing.solver.MilpModel;
import com.riansoft.pickup_routing.solver.MilpVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link RouteModelBuilder} 가 만든 MILP 모델과, 그 안의 변수들을 지점/경로 단위로 찾기 위한 색인입니다.
 * solver 실행 동안에만 존재합니다.
 */
public class RouteModel {

    /** 경로 r 에서 from -> to 구간을 선택하는 0/1 변수. */
    public static class Arc {
        public final int route;
        public final String from;
        public final String to;
        public final MilpVariable variable;

        Arc(int route, String from, String to, MilpVariable variable) {
            this.route = route;
            this.from = from;
            this.to = to;
            this.variable = variable;
        }
    }

    public final MilpModel milp;
    public final LocationGraph graph;
    public final RoutingConfig config;
    public final String startId;
    public final String endId;
    public final Set<String> anchors;
    public final List<String> customers;
    public final int routeCount;

    private final Map<String, MilpVariable> directShip = new LinkedHashMap<>();
    private final List<List<Arc>> arcsByRoute = new ArrayList<>();
    private final List<Map<String, Map<String, Arc>>> arcIndex = new ArrayList<>();
    private final List<Map<String, MilpVariable>> positions = new ArrayList<>();

    RouteModel(MilpModel milp, LocationGraph graph, RoutingConfig config, String startId, String endId,
               Set<String> anchors, List<String> customers, int routeCount) {
        this.milp = milp;
        this.graph = graph;
        this.config = config;
        this.startId = startId;
        this.endId = endId;
        this.anchors = Collections.unmodifiableSet(anchors);
        this.customers = List.copyOf(customers);
        this.routeCount = routeCount;
        for (int r = 0; r < routeCount; r++) {
            arcsByRoute.add(new ArrayList<>());
            arcIndex.add(new HashMap<>());
            positions.add(new LinkedHashMap<>());
        }
    }

    void registerDirectShip(String locationId, MilpVariable variable) {
        directShip.put(locationId, variable);
    }

    void registerArc(int route, String from, String to, MilpVariable variable) {
        Arc arc = new Arc(route, from, to, variable);
        arcsByRoute.get(route).add(arc);
        arcIndex.get(route).computeIfAbsent(from, k -> new HashMap<>()).put(to, arc);
    }

    void registerPosition(int route, String locationId, MilpVariable variable) {
        positions.get(route).put(locationId, variable);
    }

    public Map<String, MilpVariable> directShipVariables() {
        return Collections.unmodifiableMap(directShip);
    }

    public MilpVariable directShip(String locationId) {
        return directShip.get(locationId);
    }

    public List<Arc> arcs(int route) {
        return Collections.unmodifiableList(arcsByRoute.get(route));
    }

    /** 없는 구간(예: 도착 지점에서 나가는 구간)이면 null 입니다. */
    public Arc arc(int route, String from, String to) {
        Map<String, Arc> outgoing = arcIndex.get(route).get(from);
        return outgoing == null ? null : outgoing.get(to);
    }

    public List<Arc> outgoing(int route, String locationId) {
        List<Arc> result = new ArrayList<>();
        for (Arc arc : arcsByRoute.get(route)) {
            if (arc.from.equals(locationId)) result.add(arc);
        }
        return result;
    }

    public List<Arc> incoming(int route, String locationId) {
        List<Arc> result = new ArrayList<>();
        for (Arc arc : arcsByRoute.get(route)) {
            if (arc.to.equals(locationId)) result.add(arc);
        }
        return result;
    }

    public MilpVariable position(int route, String locationId) {
        return positions.get(route).get(locationId);
    }

    /** 경로 r 의 사용 여부 = 출발 지점에서 나가는 구간 변수의 합 (0 또는 1). */
    public LinearExpression routeUsed(int route) {
        LinearExpression expression = new LinearExpression();
        for (Arc arc : outgoing(route, startId)) {
            expression.plus(arc.variable);
        }
        return expression;
    }

    public boolean isAnchor(String locationId) {
        return anchors.contains(locationId);
    }
}
