package com.bit.sdupi.core;

import lombok.Getter;

/**
 * 可提交给 TokenCore 的操作类型
 */
@Getter
public enum OperationType {
    TRANSFER(false),
    TRANSFER_FROM(false),
    APPROVE(false),
    MINT(true),
    BURN(false),
    STAKE(false),
    UNSTAKE(false),
    CLAIM_REWARDS(false),
    UPDATE_POOL(true),
    SET_STAKING_ACTIVE(true),
    PAUSE(true),
    UNPAUSE(true),
    TRANSFER_OWNERSHIP(true),
    ;

    // 仅所有者可调用
    private final boolean admin;

    OperationType(boolean admin) {
        this.admin = admin;
    }
}
