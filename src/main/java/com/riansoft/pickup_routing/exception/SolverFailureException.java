package com.riansoft.pickup_routing.exception;

/**
 * solver 엔진 자체의 실패(백엔드 없음, 비정상 종료, 잘못된 모델 상태)입니다.
 */
public class SolverFailureException extends RoutingException {

    public SolverFailureException(String message) {
        super(message);
    }

    public SolverFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
