package com.riansoft.pickup_routing.service;

import com.riansoft.pickup_routing.dto.EdgeRowDto;
import com.riansoft.pickup_routing.dto.LocationRowDto;
import com.riansoft.pickup_routing.dto.OptimizationParamsDto;
import com.riansoft.pickup_routing.exception.InfeasibleModelException;
import com.riansoft.pickup_routing.exception.ValidationException;
import com.riansoft.pickup_routing.model.CostModel;
import com.riansoft.pickup_routing.model.Edge;
import com.riansoft.pickup_routing.model.FixedDecision;
import com.riansoft.pickup_routing.model.Location;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.LocationRole;
import com.riansoft.pickup_routing.model.RoutingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 수집 단계에서 받은 지점/구간 테이블과 파라미터를 {@link LocationGraph}, {@link RoutingConfig} 로 바꿉니다.
 */
@Service
public class GraphAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(GraphAssemblyService.class);

    private final double defaultMaxDrivingTimeHours;
    private final int defaultMaxRoutes;
    private final double defaultFlatRouteCostPerMinute;

    public GraphAssemblyService(@Value("${routing.defaults.max-driving-time-hours:6}") double defaultMaxDrivingTimeHours,
                                @Value("${routing.defaults.max-routes:1}") int defaultMaxRoutes,
                                @Value("${routing.defaults.flat-route-cost-per-minute:1.0}") double defaultFlatRouteCostPerMinute) {
        this.defaultMaxDrivingTimeHours = defaultMaxDrivingTimeHours;
        this.defaultMaxRoutes = defaultMaxRoutes;
        this.defaultFlatRouteCostPerMinute = defaultFlatRouteCostPerMinute;
    }

    /**
     * 포함(included)된 지점만으로 그래프를 만듭니다.
     * 허브로 표시된 행이 없으면 첫 번째 행이 허브이고, 허브는 포함 여부와 관계없이 항상 들어갑니다.
     */
    public LocationGraph assembleGraph(List<LocationRowDto> locationRows, List<EdgeRowDto> edgeRows) {
        if (locationRows == null || locationRows.isEmpty()) {
            throw new ValidationException("지점 테이블이 비어 있습니다.");
        }
        boolean hubFlagged = locationRows.stream().anyMatch(row -> Boolean.TRUE.equals(row.getHub()));

        List<Location> locations = new ArrayList<>();
        Set<String> excludedIds = new HashSet<>();
        for (int i = 0; i < locationRows.size(); i++) {
            LocationRowDto row = locationRows.get(i);
            boolean isHub = hubFlagged ? Boolean.TRUE.equals(row.getHub()) : i == 0;
            FixedDecision decision = FixedDecision.parse(row.getFixedDecision());

            if (!isHub && Boolean.FALSE.equals(row.getIncluded())) {
                if (decision == FixedDecision.FORCE_ROUTE) {
                    throw new InfeasibleModelException("지점 '" + row.getId()
                            + "'은 경로 방문으로 고정되어 있지만 최적화 대상에서 제외되어 있습니다.");
                }
                excludedIds.add(row.getId());
                continue;
            }

            if (isHub) {
                double cost = row.getDirectShipmentCost() == null ? 0 : row.getDirectShipmentCost();
                locations.add(new Location(row.getId(), row.getName(), LocationRole.HUB, cost, decision));
            } else {
                if (row.getDirectShipmentCost() == null) {
                    throw new ValidationException("지점 '" + row.getId() + "'의 직배송 비용이 없습니다.");
                }
                locations.add(new Location(row.getId(), row.getName(), LocationRole.DEPOT, row.getDirectShipmentCost(), decision));
            }
        }

        List<Edge> edges = assembleEdges(edgeRows, excludedIds);
        log.info("[DATA] 지점 {}개(제외 {}개), 구간 {}개로 그래프를 구성합니다.", locations.size(), excludedIds.size(), edges.size());
        return LocationGraph.construct(locations, edges);
    }

    /**
     * 방향이 지정된 행은 그대로 쓰고, 방향이 없는 행은 반대 방향이 따로 주어지지 않은 경우에만 뒤집어서 채웁니다.
     */
    private List<Edge> assembleEdges(List<EdgeRowDto> edgeRows, Set<String> excludedIds) {
        Map<String, Edge> explicit = new LinkedHashMap<>();
        List<Edge> undirected = new ArrayList<>();
        for (EdgeRowDto row : edgeRows == null ? List.<EdgeRowDto>of() : edgeRows) {
            if (excludedIds.contains(row.getFrom()) || excludedIds.contains(row.getTo())) continue;
            if (row.getDrivingTimeMinutes() == null) {
                throw new ValidationException("구간 '" + row.getFrom() + "' -> '" + row.getTo() + "'의 이동 시간이 없습니다.");
            }
            Edge edge = row.getDistanceMiles() == null
                    ? new Edge(row.getFrom(), row.getTo(), row.getDrivingTimeMinutes())
                    : new Edge(row.getFrom(), row.getTo(), row.getDrivingTimeMinutes(), row.getDistanceMiles());
            if (explicit.put(key(edge.from, edge.to), edge) != null) {
                throw new ValidationException("구간 '" + edge.from + "' -> '" + edge.to + "'이 테이블에 두 번 있습니다.");
            }
            if (!Boolean.TRUE.equals(row.getDirected())) {
                undirected.add(edge);
            }
        }

        List<Edge> edges = new ArrayList<>(explicit.values());
        Set<String> present = new HashSet<>(explicit.keySet());
        for (Edge edge : undirected) {
            if (present.add(key(edge.to, edge.from))) {
                edges.add(edge.mirrored());
            }
        }
        return edges;
    }

    public RoutingConfig assembleConfig(OptimizationParamsDto params) {
        OptimizationParamsDto p = params == null ? new OptimizationParamsDto() : params;
        RoutingConfig.Builder builder = RoutingConfig.builder();

        if (p.getMaxDrivingTimeMinutes() != null) {
            builder.maxDriveTimeMinutes(p.getMaxDrivingTimeMinutes());
        } else if (p.getMaxDrivingTimeHours() != null) {
            builder.maxDriveTimeHours(p.getMaxDrivingTimeHours());
        } else {
            builder.maxDriveTimeHours(defaultMaxDrivingTimeHours);
        }
        builder.maxRoutes(p.getMaxRoutes() == null ? defaultMaxRoutes : p.getMaxRoutes());

        CostModel.Type type = CostModel.Type.parse(p.getCostModel());
        if (type == CostModel.Type.FLAT) {
            builder.costModel(CostModel.flat(p.getFlatRouteCostPerMinute() == null
                    ? defaultFlatRouteCostPerMinute : p.getFlatRouteCostPerMinute()));
        } else {
            if (p.getGasCostPerMile() == null || p.getStaffCostPerHour() == null) {
                throw new ValidationException("ITEMIZED 비용 모델에는 gasCostPerMile 과 staffCostPerHour 가 모두 필요합니다.");
            }
            builder.costModel(CostModel.itemized(p.getGasCostPerMile(), p.getStaffCostPerHour()));
        }

        builder.start(p.getStartLocationId()).end(p.getEndLocationId());
        if (p.getTimeLimitSeconds() != null) {
            builder.solveTimeLimit(Duration.ofSeconds(p.getTimeLimitSeconds()));
        }
        return builder.build();
    }

    private static String key(String from, String to) {
        return from + "\u0000" + to;
    }
}
