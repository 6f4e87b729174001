package com.bit.sdupi.core;

public enum TokenEventType {
    TRANSFER,
    APPROVAL,
    MINT,
    BURN,
    STAKED,
    UNSTAKED,
    REWARD_CLAIMED,
    POOL_UPDATED,
    STAKING_STATUS,
    PAUSED,
    UNPAUSED,
    OWNERSHIP_TRANSFERRED
}
