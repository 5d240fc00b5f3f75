package com.riansoft.pickup_routing.solver;

/**
 * 조립된 MILP 모델을 풀어 주는 외부 solver 역할입니다.
 * 탐색 전략은 구현체의 관심사이며, 모델 구성 코드는 이 인터페이스만 알고 있습니다.
 */
public interface MilpSolver {

    /**
     * 모델을 풀고 결과를 돌려줍니다. 호출은 끝날 때까지 블록됩니다.
     *
     * @throws com.riansoft.pickup_routing.exception.SolverFailureException 엔진 자체가 실패한 경우
     */
    SolverOutcome solve(MilpModel model, SolveOptions options);

    /**
     * 진행 중인 모든 solve 호출에 중단을 요청합니다. 중단된 호출은 시간 제한에 도달한 것처럼 끝납니다.
     */
    void cancel();
}
