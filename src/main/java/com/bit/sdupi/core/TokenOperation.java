package com.bit.sdupi.core;

import com.bit.sdupi.common.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 类型化操作：字段按 type 取用，未用到的字段忽略
 * TRANSFER: caller -> target, amount
 * TRANSFER_FROM: caller 作为被授权方，从 from 转给 target
 * APPROVE: caller 授权 spender
 * MINT: caller(所有者) -> target
 * BURN / STAKE: caller, amount
 * UNSTAKE / CLAIM_REWARDS / PAUSE / UNPAUSE: caller
 * UPDATE_POOL: apyPercent, lockPeriod
 * SET_STAKING_ACTIVE: active
 * TRANSFER_OWNERSHIP: target 为新所有者
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenOperation {
    private OperationType type;
    private Address caller;
    private Address from;
    private Address target;
    private Address spender;
    private BigInteger amount;
    private Long apyPercent;
    private Long lockPeriod;
    private Boolean active;
}
