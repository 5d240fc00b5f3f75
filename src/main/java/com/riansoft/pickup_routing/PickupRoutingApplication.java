package com.riansoft.pickup_routing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PickupRoutingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PickupRoutingApplication.class, args);
    }
}
