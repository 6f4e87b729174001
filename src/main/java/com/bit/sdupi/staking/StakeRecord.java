package com.bit.sdupi.staking;

import com.bit.sdupi.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 单个账户的质押记录，每个账户最多一条有效记录，解除质押时删除
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StakeRecord {

    private Address staker;

    /**
     * 质押本金（最小单位）
     */
    private BigInteger amount;

    /**
     * 质押开始时间（秒）
     */
    private long startTime;

    /**
     * 创建时从质押池复制的锁定期（秒），之后池参数变化不影响本条记录
     */
    private long lockPeriod;

    /**
     * 奖励快照时间（秒），领取奖励后重置为当前时间
     */
    private long snapshotTime;

    private boolean active;

    /**
     * 锁定结束时间，溢出时取 Long.MAX_VALUE（永久锁定）
     */
    public long getLockEndTime() {
        long end = startTime + lockPeriod;
        if (lockPeriod > 0 && end < startTime) {
            return Long.MAX_VALUE;
        }
        return end;
    }

    public StakeRecord copy() {
        return new StakeRecord(staker, amount, startTime, lockPeriod, snapshotTime, active);
    }
}
