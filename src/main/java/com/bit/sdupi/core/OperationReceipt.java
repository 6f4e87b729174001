package com.bit.sdupi.core;

import com.bit.sdupi.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperationReceipt {
    private OperationType type;
    private Address caller;
    // 转账/质押/解押的本金
    private BigInteger amount;
    // 解押或领取时发放的奖励
    private BigInteger reward;
    // 执行时间（秒）
    private long timestamp;
}
