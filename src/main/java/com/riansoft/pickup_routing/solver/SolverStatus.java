package com.riansoft.pickup_routing.solver;

public enum SolverStatus {
    OPTIMAL,
    INFEASIBLE,
    /** 시간 제한(또는 취소)으로 중단됨. 해가 있으면 최선의 해이며 최적은 보장되지 않습니다. */
    TIME_LIMIT_REACHED
}
