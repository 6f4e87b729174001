package com.bit.sdupi.staking;

import java.math.BigInteger;

/**
 * 线性奖励计算，不复利：
 * annual = floor(amount * apy / 100)
 * reward = floor(annual * elapsed / SECONDS_PER_YEAR)
 * 始终使用质押池当前 APY，APY 调整对未领取区间追溯生效
 */
public final class RewardCalculator {

    public static final long SECONDS_PER_YEAR = 31_536_000L; // 365天*24h*3600s

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger YEAR = BigInteger.valueOf(SECONDS_PER_YEAR);

    private RewardCalculator() {
    }

    public static BigInteger reward(StakeRecord record, long apyPercent, long now) {
        if (record == null || !record.isActive()) {
            return BigInteger.ZERO;
        }
        long elapsed = now - record.getSnapshotTime();
        if (elapsed <= 0 || apyPercent <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger annual = record.getAmount().multiply(BigInteger.valueOf(apyPercent)).divide(HUNDRED);
        return annual.multiply(BigInteger.valueOf(elapsed)).divide(YEAR);
    }
}
