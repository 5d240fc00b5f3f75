package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.model.FixedDecision;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.solver.LinearConstraint;
import com.riansoft.pickup_routing.solver.LinearExpression;
import com.riansoft.pickup_routing.solver.MilpModel;
import com.riansoft.pickup_routing.solver.MilpVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 그래프와 설정으로 직배송/경로 배정 MILP 모델을 만듭니다.
 * <p>
 * 경로 수 R 로 매개변수화된 하나의 모델이며, 단일 경로 모드는 R = 1 인 경우입니다.
 * 부분 순환(subtour)은 MTZ 방식의 위치 변수로 제거합니다.
 */
@Service
public class RouteModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(RouteModelBuilder.class);

    public RouteModel build(LocationGraph graph, RoutingConfig config) {
        config.validateAgainst(graph);

        String start = config.resolveStart(graph);
        String end = config.resolveEnd(graph);
        boolean closedTour = start.equals(end);

        Set<String> anchors = new LinkedHashSet<>();
        anchors.add(start);
        anchors.add(end);

        List<String> customers = new ArrayList<>();
        for (Location location : graph.locations()) {
            if (!location.isHub() && !anchors.contains(location.id)) {
                customers.add(location.id);
            }
        }
        List<String> routable = new ArrayList<>(anchors);
        routable.addAll(customers);

        int routeCount = config.maxRoutes;
        MilpModel milp = new MilpModel("pickup-routing");
        RouteModel model = new RouteModel(milp, graph, config, start, end, anchors, customers, routeCount);

        log.info("[MODEL] 모델 생성 시작: 출발 '{}', 도착 '{}', 대상 지점 {}개, 경로 {}개",
                start, end, customers.size(), routeCount);

        // 1. 변수
        for (Location location : graph.locations()) {
            if (location.isHub()) continue;
            model.registerDirectShip(location.id, milp.addBinary("direct[" + location.id + "]"));
        }
        for (int r = 0; r < routeCount; r++) {
            for (String from : routable) {
                for (String to : routable) {
                    if (from.equals(to)) continue;
                    if (!closedTour && (to.equals(start) || from.equals(end) || (from.equals(start) && to.equals(end)))) {
                        continue;
                    }
                    model.registerArc(r, from, to, milp.addBinary("arc[" + from + "," + to + "," + (r + 1) + "]"));
                }
            }
            for (String customer : customers) {
                model.registerPosition(r, customer,
                        milp.addInteger("pos[" + customer + "," + (r + 1) + "]", 1, customers.size()));
            }
        }

        // 2. 제약
        addCoverage(model);
        addDegreeBalance(model);
        addAnchoring(model);
        addTimeBudget(model);
        addSubtourElimination(model);
        addFixedDecisions(model);
        addRouteOrdering(model);
        addRouteCountCap(model);

        log.info("[MODEL] 모델 생성 완료: 변수 {}개, 제약 {}개", milp.getVariables().size(), milp.getConstraints().size());
        return model;
    }

    /** 각 대상 지점은 직배송이거나, 정확히 한 경로에서 한 번 방문됩니다. */
    private void addCoverage(RouteModel model) {
        for (String customer : model.customers) {
            LinearExpression expression = new LinearExpression().plus(model.directShip(customer));
            for (int r = 0; r < model.routeCount; r++) {
                for (RouteModel.Arc arc : model.incoming(r, customer)) {
                    expression.plus(arc.variable);
                }
            }
            model.milp.add(LinearConstraint.equalTo("coverage[" + customer + "]", expression, 1));
        }
    }

    private void addDegreeBalance(RouteModel model) {
        for (int r = 0; r < model.routeCount; r++) {
            for (String customer : model.customers) {
                LinearExpression expression = new LinearExpression();
                for (RouteModel.Arc arc : model.incoming(r, customer)) {
                    expression.plus(arc.variable);
                }
                for (RouteModel.Arc arc : model.outgoing(r, customer)) {
                    expression.minus(arc.variable);
                }
                model.milp.add(LinearConstraint.equalTo("balance[" + customer + "," + (r + 1) + "]", expression, 0));
            }
        }
    }

    /**
     * 사용되는 경로는 출발 지점에서 한 번 나가고 도착 지점으로 한 번 들어옵니다.
     * 출발 == 도착이면 허브 기준 닫힌 순회가 됩니다.
     * 출발/도착으로 쓰인 depot 은 경로가 하나라도 운행되면 그 경로의 끝점으로 수거되고,
     * 운행되는 경로가 없으면 직배송됩니다. route_order 때문에 경로 1 의 사용 여부가 곧 경로 운행 여부입니다.
     */
    private void addAnchoring(RouteModel model) {
        for (int r = 0; r < model.routeCount; r++) {
            model.milp.add(LinearConstraint.atMost("start_out[" + (r + 1) + "]", model.routeUsed(r), 1));

            LinearExpression balance = new LinearExpression();
            for (RouteModel.Arc arc : model.incoming(r, model.endId)) {
                balance.plus(arc.variable);
            }
            for (RouteModel.Arc arc : model.outgoing(r, model.startId)) {
                balance.minus(arc.variable);
            }
            model.milp.add(LinearConstraint.equalTo("anchor_balance[" + (r + 1) + "]", balance, 0));
        }
        for (String anchor : model.anchors) {
            MilpVariable direct = model.directShip(anchor);
            if (direct != null) {
                LinearExpression expression = model.routeUsed(0).plus(direct);
                model.milp.add(LinearConstraint.equalTo("anchor_coverage[" + anchor + "]", expression, 1));
            }
        }
    }

    private void addTimeBudget(RouteModel model) {
        for (int r = 0; r < model.routeCount; r++) {
            LinearExpression expression = new LinearExpression();
            for (RouteModel.Arc arc : model.arcs(r)) {
                double time = model.graph.time(arc.from, arc.to);
                if (time != 0) {
                    expression.plus(arc.variable, time);
                }
            }
            model.milp.add(LinearConstraint.atMost("time_budget[" + (r + 1) + "]", expression, model.config.maxDriveTimeMinutes));
        }
    }

    /**
     * pos[i] - pos[j] + n * arc[i,j] <= n - 1.
     * arc[i,j] 가 선택되면 pos[j] >= pos[i] + 1 이 되어 대상 지점들만으로 이루어진 순환이 불가능해집니다.
     */
    private void addSubtourElimination(RouteModel model) {
        int n = model.customers.size();
        if (n < 2) return;
        for (int r = 0; r < model.routeCount; r++) {
            for (String from : model.customers) {
                for (String to : model.customers) {
                    if (from.equals(to)) continue;
                    RouteModel.Arc arc = model.arc(r, from, to);
                    LinearExpression expression = new LinearExpression()
                            .plus(model.position(r, from))
                            .minus(model.position(r, to))
                            .plus(arc.variable, n);
                    model.milp.add(LinearConstraint.atMost("mtz[" + from + "," + to + "," + (r + 1) + "]", expression, n - 1));
                }
            }
        }
    }

    /**
     * 고정 결정은 변수를 지우지 않고 등식 제약으로만 추가합니다.
     * 서로 모순되는 고정 결정은 solver 단계에서 INFEASIBLE 로 드러납니다.
     */
    private void addFixedDecisions(RouteModel model) {
        for (Location location : model.graph.locations()) {
            if (location.isHub() || location.fixedDecision == FixedDecision.UNCONSTRAINED) continue;
            MilpVariable direct = model.directShip(location.id);
            if (location.fixedDecision == FixedDecision.FORCE_DIRECT) {
                model.milp.add(LinearConstraint.equalTo("fix_direct[" + location.id + "]", new LinearExpression().plus(direct), 1));
                for (int r = 0; r < model.routeCount; r++) {
                    for (RouteModel.Arc arc : model.arcs(r)) {
                        if (arc.from.equals(location.id) || arc.to.equals(location.id)) {
                            model.milp.add(LinearConstraint.equalTo(
                                    "fix_arc[" + arc.from + "," + arc.to + "," + (r + 1) + "]",
                                    new LinearExpression().plus(arc.variable), 0));
                        }
                    }
                }
            } else {
                model.milp.add(LinearConstraint.equalTo("fix_route[" + location.id + "]", new LinearExpression().plus(direct), 0));
            }
            log.info("[MODEL] 고정 결정 적용: '{}' -> {}", location.id, location.fixedDecision);
        }
    }

    /** 경로 r 은 경로 r-1 이 사용될 때만 사용됩니다. 같은 해가 경로 번호만 바뀌어 반복되는 것을 막습니다. */
    private void addRouteOrdering(RouteModel model) {
        for (int r = 1; r < model.routeCount; r++) {
            LinearExpression expression = model.routeUsed(r);
            for (RouteModel.Arc arc : model.outgoing(r - 1, model.startId)) {
                expression.minus(arc.variable);
            }
            model.milp.add(LinearConstraint.atMost("route_order[" + (r + 1) + "]", expression, 0));
        }
    }

    private void addRouteCountCap(RouteModel model) {
        if (model.config.isSingleRoute()) return;
        LinearExpression expression = new LinearExpression();
        for (int r = 0; r < model.routeCount; r++) {
            for (RouteModel.Arc arc : model.outgoing(r, model.startId)) {
                expression.plus(arc.variable);
            }
        }
        model.milp.add(LinearConstraint.atMost("route_cap", expression, model.config.maxRoutes));
    }
}
