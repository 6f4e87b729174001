package com.bit.sdupi.ledger;

import com.bit.sdupi.common.Address;

import java.math.BigInteger;

/**
 * 账本：独占余额、总供应量与授权额度
 * 不变量：所有账户余额之和（含质押托管地址）== 总供应量
 * 实现本身不加锁，由 TokenCore 串行化调用
 */
public interface Ledger {

    BigInteger balanceOf(Address account);

    BigInteger totalSupply();

    BigInteger allowance(Address owner, Address spender);

    /**
     * 普通转账
     * @param from 转出方
     * @param to 接收方（不能是空地址或质押托管地址）
     * @param amount 最小单位金额，非负
     */
    void transfer(Address from, Address to, BigInteger amount);

    /**
     * 代扣转账，扣减 from 对 spender 的授权额度
     */
    void transferFrom(Address spender, Address from, Address to, BigInteger amount);

    /**
     * 设置授权额度（覆盖原值）
     */
    void approve(Address owner, Address spender, BigInteger amount);

    /**
     * 增发，总供应量同步增加
     */
    void mint(Address to, BigInteger amount);

    /**
     * 销毁持有人自己的余额，总供应量同步减少
     */
    void burn(Address holder, BigInteger amount);

    /**
     * 质押托管：本金从账户转入托管地址
     */
    void escrow(Address from, BigInteger amount);

    /**
     * 解除托管：本金从托管地址退回账户
     */
    void release(Address to, BigInteger amount);

    LedgerState snapshot();

    void restore(LedgerState state);
}
