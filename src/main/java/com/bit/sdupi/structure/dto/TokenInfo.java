package com.bit.sdupi.structure.dto;

import com.bit.sdupi.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 代币元数据（name/symbol/decimals/totalSupply）及系统状态
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenInfo {
    private String name;
    private String symbol;
    private int decimals;
    private BigInteger totalSupply;
    private Address owner;
    private boolean paused;
}
