package com.riansoft.pickup_routing.exception;

/**
 * 그래프 또는 설정값이 잘못되었을 때 solver 호출 전에 던져집니다.
 * 메시지는 처음 발견된 위반 사항 하나를 가리킵니다.
 */
public class ValidationException extends RoutingException {

    public ValidationException(String message) {
        super(message);
    }
}
