package com.bit.sdupi.core;

import lombok.Getter;

@Getter
public enum ErrorType {
    UNAUTHORIZED(401, "调用方不是合约所有者"),
    SYSTEM_PAUSED(402, "系统已暂停"),
    INVALID_AMOUNT(403, "金额非法"),
    INVALID_RECIPIENT(404, "接收地址非法"),
    INSUFFICIENT_BALANCE(405, "余额不足"),
    INSUFFICIENT_ALLOWANCE(406, "授权额度不足"),
    STAKING_INACTIVE(410, "质押池未开放"),
    AMOUNT_OUT_OF_RANGE(411, "质押数量超出范围"),
    ALREADY_STAKED(412, "已存在有效质押"),
    NO_ACTIVE_STAKE(413, "不存在有效质押"),
    LOCK_NOT_ELAPSED(414, "锁定期未结束"),
    NO_REWARDS_AVAILABLE(415, "暂无可领取奖励"),
    REENTRANCY_DETECTED(420, "检测到重入调用"),
    INVALID_OPERATION(430, "操作参数不完整"),
    DUPLICATE_OPERATION(431, "操作已处理");

    // 对外返回的错误码（Result.code）
    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }
}
