package com.riansoft.pickup_routing.dto;

import java.util.List;

// 최적화 요청의 최상위 DTO
public class OptimizationRequestDto {
    private List<LocationRowDto> locations;
    private List<EdgeRowDto> edges;
    private OptimizationParamsDto params;

    // Getters and Setters
    public List<LocationRowDto> getLocations() { return locations; }
    public void setLocations(List<LocationRowDto> locations) { this.locations = locations; }
    public List<EdgeRowDto> getEdges() { return edges; }
    public void setEdges(List<EdgeRowDto> edges) { this.edges = edges; }
    public OptimizationParamsDto getParams() { return params; }
    public void setParams(OptimizationParamsDto params) { this.params = params; }
}
