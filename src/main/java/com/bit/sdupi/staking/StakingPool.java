package com.bit.sdupi.staking;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 全局唯一质押池
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StakingPool {

    private BigInteger totalStaked = BigInteger.ZERO;

    private BigInteger totalRewardsPaid = BigInteger.ZERO;

    // 年化收益率（百分比，整数）
    private long apyPercent;

    // 新质押的锁定期（秒）
    private long lockPeriod;

    // 仅控制新质押，不影响已有质押的解除与领取
    private boolean active;

    public StakingPool(long apyPercent, long lockPeriod, boolean active) {
        this.apyPercent = apyPercent;
        this.lockPeriod = lockPeriod;
        this.active = active;
    }

    public StakingPool copy() {
        return new StakingPool(totalStaked, totalRewardsPaid, apyPercent, lockPeriod, active);
    }
}
