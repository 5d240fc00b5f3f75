package com.riansoft.pickup_routing.exception;

/**
 * solver가 고른 arc 집합으로 단일 경로를 복원할 수 없을 때 던져집니다.
 * 사용자 입력 오류가 아니라 모델링 결함이므로 항상 치명적으로 취급합니다.
 */
public class ReconstructionException extends RoutingException {

    public ReconstructionException(String message) {
        super(message);
    }
}
