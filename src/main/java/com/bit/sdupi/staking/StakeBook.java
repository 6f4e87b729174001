package com.bit.sdupi.staking;

import com.bit.sdupi.common.Address;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigInteger;

/**
 * 质押账簿：独占质押记录，质押/解除/领取时联动账本余额与质押池汇总
 */
public interface StakeBook {

    /**
     * 质押
     * @return 新建的质押记录副本
     */
    StakeRecord stake(Address account, BigInteger amount, long now);

    /**
     * 解除质押，退回本金并发放奖励
     * @return 已删除记录的副本与本次发放奖励
     */
    Settlement unstake(Address account, long now);

    /**
     * 领取奖励并重置快照时间
     * @return 本次发放的奖励
     */
    BigInteger claimRewards(Address account, long now);

    StakeRecord getRecord(Address account);

    BigInteger pendingReward(Address account, long now);

    StakingPool getPool();

    StakeBookState snapshot();

    void restore(StakeBookState state);

    /**
     * 本金与奖励结算结果
     */
    @Getter
    @AllArgsConstructor
    class Settlement {
        private final StakeRecord record;
        private final BigInteger reward;
    }
}
