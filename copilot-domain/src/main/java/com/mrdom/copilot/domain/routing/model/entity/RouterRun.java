package com.mrdom.copilot.domain.routing.model.entity;

import com.mrdom.copilot.domain.routing.model.valobj.RoutingDecision;
import com.mrdom.copilot.types.enums.RouterStateEnum;
import lombok.Getter;

/**
 * 一次性路由运行：START -> CLASSIFIED | FAILED，终态不可再迁移。
 */
@Getter
public class RouterRun {

    private RouterStateEnum state = RouterStateEnum.START;
    private RoutingDecision decision;
    private String failureReason;

    public void classify(RoutingDecision result) {
        if (result == null) {
            throw new IllegalStateException("Routing decision cannot be null");
        }
        transitionTo(RouterStateEnum.CLASSIFIED);
        this.decision = result;
    }

    public void fail(String reason) {
        transitionTo(RouterStateEnum.FAILED);
        this.failureReason = reason;
    }

    public boolean isFailed() {
        return state == RouterStateEnum.FAILED;
    }

    /**
     * 分类成功时返回决策；失败时返回 UNKNOWN。
     */
    public RoutingDecision effectiveDecision() {
        if (state == RouterStateEnum.CLASSIFIED) {
            return decision;
        }
        if (state == RouterStateEnum.FAILED) {
            return RoutingDecision.unknown("router failed: " + failureReason);
        }
        throw new IllegalStateException("Router run has not finished");
    }

    private void transitionTo(RouterStateEnum target) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Router run already " + state + ", cannot move to " + target);
        }
        this.state = target;
    }
}
