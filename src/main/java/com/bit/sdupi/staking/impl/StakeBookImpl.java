package com.bit.sdupi.staking.impl;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenException;
import com.bit.sdupi.ledger.Ledger;
import com.bit.sdupi.staking.RewardCalculator;
import com.bit.sdupi.staking.StakeBook;
import com.bit.sdupi.staking.StakeBookState;
import com.bit.sdupi.staking.StakeRecord;
import com.bit.sdupi.staking.StakingPool;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 所有前置条件校验完成后才修改状态，校验失败不留下任何中间状态
 */
@Slf4j
public class StakeBookImpl implements StakeBook {

    private final Map<Address, StakeRecord> records = new HashMap<>();
    private final Ledger ledger;
    private final StakingPool pool;
    private final BigInteger minStake;
    private final BigInteger maxStake;

    public StakeBookImpl(Ledger ledger, StakingPool pool, BigInteger minStake, BigInteger maxStake) {
        if (minStake.compareTo(maxStake) > 0) {
            throw new IllegalArgumentException("最小质押量不能大于最大质押量");
        }
        this.ledger = ledger;
        this.pool = pool;
        this.minStake = minStake;
        this.maxStake = maxStake;
    }

    @Override
    public StakeRecord stake(Address account, BigInteger amount, long now) {
        if (!pool.isActive()) {
            throw new TokenException(ErrorType.STAKING_INACTIVE, "质押池已关闭");
        }
        if (amount == null || amount.compareTo(minStake) < 0 || amount.compareTo(maxStake) > 0) {
            throw new TokenException(ErrorType.AMOUNT_OUT_OF_RANGE,
                    "质押数量: " + amount + ", 允许范围: [" + minStake + ", " + maxStake + "]");
        }
        BigInteger balance = ledger.balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new TokenException(ErrorType.INSUFFICIENT_BALANCE,
                    "账户 " + account + " 余额: " + balance + ", 质押: " + amount);
        }
        StakeRecord existing = records.get(account);
        if (existing != null && existing.isActive()) {
            throw new TokenException(ErrorType.ALREADY_STAKED, "账户 " + account + " 已有有效质押");
        }

        ledger.escrow(account, amount);
        StakeRecord record = new StakeRecord(account, amount, now, pool.getLockPeriod(), now, true);
        records.put(account, record);
        pool.setTotalStaked(pool.getTotalStaked().add(amount));
        log.debug("质押记录创建: {}", record);
        return record.copy();
    }

    @Override
    public Settlement unstake(Address account, long now) {
        StakeRecord record = requireActive(account);
        if (now < record.getLockEndTime()) {
            throw new TokenException(ErrorType.LOCK_NOT_ELAPSED,
                    "锁定期结束时间: " + record.getLockEndTime() + ", 当前: " + now);
        }
        BigInteger reward = RewardCalculator.reward(record, pool.getApyPercent(), now);

        records.remove(account);
        pool.setTotalStaked(pool.getTotalStaked().subtract(record.getAmount()));
        pool.setTotalRewardsPaid(pool.getTotalRewardsPaid().add(reward));
        ledger.release(account, record.getAmount());
        if (reward.signum() > 0) {
            ledger.mint(account, reward);
        }
        record.setActive(false);
        return new Settlement(record, reward);
    }

    @Override
    public BigInteger claimRewards(Address account, long now) {
        StakeRecord record = requireActive(account);
        BigInteger reward = RewardCalculator.reward(record, pool.getApyPercent(), now);
        if (reward.signum() <= 0) {
            throw new TokenException(ErrorType.NO_REWARDS_AVAILABLE, "账户 " + account + " 暂无奖励");
        }
        ledger.mint(account, reward);
        record.setSnapshotTime(now);
        pool.setTotalRewardsPaid(pool.getTotalRewardsPaid().add(reward));
        return reward;
    }

    @Override
    public StakeRecord getRecord(Address account) {
        StakeRecord record = records.get(account);
        return record == null ? null : record.copy();
    }

    @Override
    public BigInteger pendingReward(Address account, long now) {
        return RewardCalculator.reward(records.get(account), pool.getApyPercent(), now);
    }

    @Override
    public StakingPool getPool() {
        return pool;
    }

    @Override
    public StakeBookState snapshot() {
        return new StakeBookState(records, pool);
    }

    @Override
    public void restore(StakeBookState state) {
        records.clear();
        state.getRecords().forEach((account, record) -> records.put(account, record.copy()));
        StakingPool saved = state.getPool();
        pool.setTotalStaked(saved.getTotalStaked());
        pool.setTotalRewardsPaid(saved.getTotalRewardsPaid());
        pool.setApyPercent(saved.getApyPercent());
        pool.setLockPeriod(saved.getLockPeriod());
        pool.setActive(saved.isActive());
    }

    private StakeRecord requireActive(Address account) {
        StakeRecord record = records.get(account);
        if (record == null || !record.isActive()) {
            throw new TokenException(ErrorType.NO_ACTIVE_STAKE, "账户 " + account + " 没有有效质押");
        }
        return record;
    }
}
