package com.riansoft.pickup_routing.controller;

import com.riansoft.pickup_routing.dto.OptimizationRequestDto;
import com.riansoft.pickup_routing.dto.RouteSolutionDto;
import com.riansoft.pickup_routing.model.LocationGraph;
import com.riansoft.pickup_routing.model.OptimizationResult;
import com.riansoft.pickup_routing.model.RoutingConfig;
import com.riansoft.pickup_routing.service.GraphAssemblyService;
import com.riansoft.pickup_routing.service.RouteOptimizationService;
import com.riansoft.pickup_routing.service.SolutionFormatterService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class RouteController {

    private final RouteOptimizationService routeService;
    private final GraphAssemblyService graphAssemblyService;
    private final SolutionFormatterService solutionFormatterService;

    @Autowired
    public RouteController(RouteOptimizationService routeService, GraphAssemblyService graphAssemblyService,
                           SolutionFormatterService solutionFormatterService) {
        this.routeService = routeService;
        this.graphAssemblyService = graphAssemblyService;
        this.solutionFormatterService = solutionFormatterService;
    }

    /**
     * 지점/구간 테이블과 파라미터를 받아 직배송 목록과 최적 경로를 계산합니다.
     * 오류는 {@link GlobalExceptionHandler} 가 응답으로 바꿉니다.
     */
    @PostMapping("/optimize-routes")
    public ResponseEntity<RouteSolutionDto> optimizeRoutes(@RequestBody OptimizationRequestDto request) {
        LocationGraph graph = graphAssemblyService.assembleGraph(request.getLocations(), request.getEdges());
        RoutingConfig config = graphAssemblyService.assembleConfig(request.getParams());
        OptimizationResult result = routeService.optimize(graph, config);
        return ResponseEntity.ok(solutionFormatterService.formatSolutionToDto(result));
    }

    /**
     * 진행 중인 계산을 멈춥니다. 이미 찾은 해가 있으면 해당 요청은 TIME_LIMIT_REACHED 로 응답합니다.
     */
    @PostMapping("/optimize-routes/cancel")
    public ResponseEntity<Void> cancelOptimization() {
        routeService.cancelRunningOptimizations();
        return ResponseEntity.accepted().build();
    }
}
