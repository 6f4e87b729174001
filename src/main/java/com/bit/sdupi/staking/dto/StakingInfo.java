package com.bit.sdupi.staking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StakingInfo {
    private BigInteger amount;
    private long startTime;
    private long lockEndTime;
    private BigInteger currentReward;
    private boolean staked;

    public static StakingInfo empty() {
        return new StakingInfo(BigInteger.ZERO, 0, 0, BigInteger.ZERO, false);
    }
}
