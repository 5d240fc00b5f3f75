package com.riansoft.pickup_routing.controller;

import com.riansoft.pickup_routing.dto.ErrorResponseDto;
import com.riansoft.pickup_routing.exception.InfeasibleModelException;
import com.riansoft.pickup_routing.exception.ReconstructionException;
import com.riansoft.pickup_routing.exception.SolverFailureException;
import com.riansoft.pickup_routing.exception.SolverTimeoutException;
import com.riansoft.pickup_routing.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 전역 예외 처리기. 최적화 예외를 종류별 HTTP 상태와 오류 본문으로 바꿉니다.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(ValidationException e) {
        log.warn("입력 검증 실패: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e);
    }

    @ExceptionHandler(InfeasibleModelException.class)
    public ResponseEntity<ErrorResponseDto> handleInfeasible(InfeasibleModelException e) {
        log.warn("실행 불가능한 모델: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "INFEASIBLE_MODEL", e);
    }

    @ExceptionHandler(SolverTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> handleTimeout(SolverTimeoutException e) {
        log.warn("solver 시간 초과 ({}ms): {}", e.getWallTimeMillis(), e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, "SOLVER_TIMEOUT", e);
    }

    @ExceptionHandler(ReconstructionException.class)
    public ResponseEntity<ErrorResponseDto> handleReconstruction(ReconstructionException e) {
        log.error("경로 복원 실패 (모델링 결함)", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "RECONSTRUCTION_ERROR", e);
    }

    @ExceptionHandler(SolverFailureException.class)
    public ResponseEntity<ErrorResponseDto> handleSolverFailure(SolverFailureException e) {
        log.error("solver 실패", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "SOLVER_FAILURE", e);
    }

    private ResponseEntity<ErrorResponseDto> error(HttpStatus status, String code, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(code, e.getMessage()));
    }
}
