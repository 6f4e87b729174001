package com.bit.sdupi.core;

import com.bit.sdupi.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 成功执行的状态变更事件，失败的操作不产生事件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenEvent {
    private long sequence;
    private TokenEventType type;
    private Address from;
    private Address to;
    private BigInteger amount;
    private long timestamp;
}
