package com.riansoft.pickup_routing.model;

public enum LocationRole {
    HUB,
    DEPOT
}
