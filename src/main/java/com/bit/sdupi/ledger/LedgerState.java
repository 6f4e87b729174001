package com.bit.sdupi.ledger;

import com.bit.sdupi.common.Address;
import lombok.Getter;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 账本快照，用于操作失败时整体回滚
 */
@Getter
public class LedgerState {
    private final Map<Address, BigInteger> balances;
    private final Map<Address, Map<Address, BigInteger>> allowances;
    private final BigInteger totalSupply;

    public LedgerState(Map<Address, BigInteger> balances,
                       Map<Address, Map<Address, BigInteger>> allowances,
                       BigInteger totalSupply) {
        this.balances = new HashMap<>(balances);
        this.allowances = new HashMap<>();
        allowances.forEach((owner, spenders) -> this.allowances.put(owner, new HashMap<>(spenders)));
        this.totalSupply = totalSupply;
    }
}
