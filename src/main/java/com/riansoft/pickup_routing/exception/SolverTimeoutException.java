package com.riansoft.pickup_routing.exception;

/**
 * 시간 제한에 도달했지만 실행 가능한 해(incumbent)를 하나도 찾지 못한 경우입니다.
 * 해가 있으면 예외 대신 TIME_LIMIT_REACHED 상태로 결과가 반환됩니다.
 */
public class SolverTimeoutException extends RoutingException {

    private final long wallTimeMillis;

    public SolverTimeoutException(String message, long wallTimeMillis) {
        super(message);
        this.wallTimeMillis = wallTimeMillis;
    }

    public long getWallTimeMillis() {
        return wallTimeMillis;
    }
}
