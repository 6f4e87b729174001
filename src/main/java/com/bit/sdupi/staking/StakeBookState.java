package com.bit.sdupi.staking;

import com.bit.sdupi.common.Address;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 质押记录与质押池快照
 */
@Getter
public class StakeBookState {
    private final Map<Address, StakeRecord> records = new HashMap<>();
    private final StakingPool pool;

    public StakeBookState(Map<Address, StakeRecord> records, StakingPool pool) {
        records.forEach((account, record) -> this.records.put(account, record.copy()));
        this.pool = pool.copy();
    }
}
