package com.riansoft.pickup_routing.model;

import com.riansoft.pickup_routing.RoutingFixtures;
import com.riansoft.pickup_routing.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RoutingConfigTest {

    @Test
    @DisplayName("시간 단위 입력은 분으로 정규화되고 출발/도착 기본값은 허브다")
    void normalizesHoursAndDefaultsToHub() {
        RoutingConfig config = RoutingConfig.builder().maxDriveTimeHours(6).build();
        LocationGraph graph = RoutingFixtures.scenarioGraph();

        assertEquals(360, config.maxDriveTimeMinutes);
        assertTrue(config.isSingleRoute());
        assertEquals("H", config.resolveStart(graph));
        assertEquals("H", config.resolveEnd(graph));
    }

    @Test
    @DisplayName("잘못된 제한 시간, 경로 수, 비용 계수는 거부된다")
    void rejectsBadValues() {
        assertThrows(ValidationException.class, () -> RoutingConfig.builder().build());
        assertThrows(ValidationException.class, () -> RoutingConfig.builder().maxDriveTimeMinutes(0).build());
        assertThrows(ValidationException.class, () -> RoutingConfig.builder().maxDriveTimeMinutes(60).maxRoutes(0).build());
        assertThrows(ValidationException.class, () -> RoutingConfig.builder().maxDriveTimeMinutes(60)
                .solveTimeLimit(Duration.ZERO).build());
        assertThrows(ValidationException.class, () -> CostModel.flat(-1));
        assertThrows(ValidationException.class, () -> CostModel.itemized(1, Double.NaN));
    }

    @Test
    @DisplayName("그래프에 없는 출발 지점은 거부된다")
    void rejectsUnknownAnchor() {
        RoutingConfig config = RoutingConfig.builder().maxDriveTimeMinutes(60).start("X").build();

        ValidationException e = assertThrows(ValidationException.class,
                () -> config.validateAgainst(RoutingFixtures.scenarioGraph()));
        assertTrue(e.getMessage().contains("'X'"));
    }

    @Test
    @DisplayName("ITEMIZED 모델은 거리가 없는 구간을 거부한다")
    void itemizedNeedsDistances() {
        List<Edge> edges = new ArrayList<>();
        RoutingFixtures.addBoth(edges, "H", "A", 20);
        LocationGraph graph = LocationGraph.construct(List.of(Location.hub("H"), Location.depot("A", 10)), edges);
        RoutingConfig config = RoutingConfig.builder().maxDriveTimeMinutes(60)
                .costModel(CostModel.itemized(0.5, 30)).build();

        assertThrows(ValidationException.class, () -> config.validateAgainst(graph));
    }
}
