package com.riansoft.pickup_routing.exception;

/**
 * 경로 최적화 실행 중 발생하는 모든 예외의 공통 부모 클래스입니다.
 * 재시도 정책은 호출자가 결정하며, 코어는 어떤 예외도 자동으로 재시도하지 않습니다.
 */
public abstract class RoutingException extends RuntimeException {

    protected RoutingException(String message) {
        super(message);
    }

    protected RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
