package com.mrdom.copilot.types.enums;

/**
 * 意图路由状态机状态。
 */
public enum RouterStateEnum {
    START,
    CLASSIFIED,
    FAILED;

    public boolean isTerminal() {
        return this != START;
    }
}
