package com.riansoft.pickup_routing.exception;

/**
 * 고정 결정(fixed decision)이나 운행 시간 제한 때문에 가능한 배정이 없을 때 던져집니다.
 */
public class InfeasibleModelException extends RoutingException {

    public InfeasibleModelException(String message) {
        super(message);
    }
}
