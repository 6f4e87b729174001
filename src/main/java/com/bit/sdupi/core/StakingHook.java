package com.bit.sdupi.core;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.staking.StakeRecord;

import java.math.BigInteger;

/**
 * 质押回调：在本金托管/退回之后、操作返回之前于同一线程内调用
 * 回调期间重入保护处于开启状态，回调内对 TokenCore 的任何变更调用都会失败（REENTRANCY_DETECTED）
 * 回调抛出异常时整个操作回滚
 */
public interface StakingHook {

    default void onStaked(TokenCore core, StakeRecord record) {
    }

    default void onUnstaked(TokenCore core, StakeRecord record, BigInteger reward) {
    }

    default void onRewardClaimed(TokenCore core, Address account, BigInteger reward) {
    }
}
