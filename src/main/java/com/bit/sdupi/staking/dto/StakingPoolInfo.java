package com.bit.sdupi.staking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StakingPoolInfo {
    private BigInteger totalStaked;
    private BigInteger totalRewardsPaid;
    private long apyPercent;
    private long lockPeriod;
    private boolean active;
}
