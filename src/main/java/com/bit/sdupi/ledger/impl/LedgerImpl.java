package com.bit.sdupi.ledger.impl;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenException;
import com.bit.sdupi.ledger.Ledger;
import com.bit.sdupi.ledger.LedgerState;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

@Slf4j
public class LedgerImpl implements Ledger {

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    /**
     * 创世铸造：全部初始供应量归属所有者
     */
    public LedgerImpl(Address genesisHolder, BigInteger genesisSupply) {
        if (genesisSupply.signum() > 0) {
            mint(genesisHolder, genesisSupply);
        }
        log.info("账本初始化完成，创世持有人: {}, 总供应量: {}", genesisHolder, totalSupply);
    }

    @Override
    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public BigInteger allowance(Address owner, Address spender) {
        Map<Address, BigInteger> spenders = allowances.get(owner);
        return spenders == null ? BigInteger.ZERO : spenders.getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public void transfer(Address from, Address to, BigInteger amount) {
        requireNonNegative(amount);
        requireRecipient(to);
        requireBalance(from, amount);
        move(from, to, amount);
    }

    @Override
    public void transferFrom(Address spender, Address from, Address to, BigInteger amount) {
        requireNonNegative(amount);
        requireRecipient(to);
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            throw new TokenException(ErrorType.INSUFFICIENT_ALLOWANCE,
                    "授权额度: " + allowed + ", 需要: " + amount);
        }
        requireBalance(from, amount);
        setAllowance(from, spender, allowed.subtract(amount));
        move(from, to, amount);
    }

    @Override
    public void approve(Address owner, Address spender, BigInteger amount) {
        if (spender == null || spender.isNull()) {
            throw new TokenException(ErrorType.INVALID_RECIPIENT, "被授权地址不能为空地址");
        }
        requireNonNegative(amount);
        setAllowance(owner, spender, amount);
    }

    @Override
    public void mint(Address to, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new TokenException(ErrorType.INVALID_AMOUNT, "增发数量必须大于0");
        }
        if (to == null || to.isNull()) {
            throw new TokenException(ErrorType.INVALID_AMOUNT, "增发地址不能为空地址");
        }
        if (to.equals(Address.STAKING_RESERVE)) {
            throw new TokenException(ErrorType.INVALID_RECIPIENT, "不能向质押托管地址增发");
        }
        credit(to, amount);
        totalSupply = totalSupply.add(amount);
    }

    @Override
    public void burn(Address holder, BigInteger amount) {
        requireNonNegative(amount);
        requireBalance(holder, amount);
        debit(holder, amount);
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public void escrow(Address from, BigInteger amount) {
        requireBalance(from, amount);
        move(from, Address.STAKING_RESERVE, amount);
    }

    @Override
    public void release(Address to, BigInteger amount) {
        requireBalance(Address.STAKING_RESERVE, amount);
        move(Address.STAKING_RESERVE, to, amount);
    }

    @Override
    public LedgerState snapshot() {
        return new LedgerState(balances, allowances, totalSupply);
    }

    @Override
    public void restore(LedgerState state) {
        balances.clear();
        balances.putAll(state.getBalances());
        allowances.clear();
        state.getAllowances().forEach((owner, spenders) -> allowances.put(owner, new HashMap<>(spenders)));
        totalSupply = state.getTotalSupply();
    }

    private void move(Address from, Address to, BigInteger amount) {
        if (amount.signum() == 0 || from.equals(to)) {
            return;
        }
        debit(from, amount);
        credit(to, amount);
    }

    private void credit(Address account, BigInteger amount) {
        balances.merge(account, amount, BigInteger::add);
    }

    // 余额归零时移除条目
    private void debit(Address account, BigInteger amount) {
        BigInteger remaining = balanceOf(account).subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(account);
        } else {
            balances.put(account, remaining);
        }
    }

    private void setAllowance(Address owner, Address spender, BigInteger amount) {
        Map<Address, BigInteger> spenders = allowances.computeIfAbsent(owner, k -> new HashMap<>());
        if (amount.signum() == 0) {
            spenders.remove(spender);
            if (spenders.isEmpty()) {
                allowances.remove(owner);
            }
        } else {
            spenders.put(spender, amount);
        }
    }

    private void requireBalance(Address account, BigInteger amount) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new TokenException(ErrorType.INSUFFICIENT_BALANCE,
                    "账户 " + account + " 余额: " + balance + ", 需要: " + amount);
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new TokenException(ErrorType.INVALID_AMOUNT, "金额不能为负: " + amount);
        }
    }

    private static void requireRecipient(Address to) {
        if (to == null || to.isNull()) {
            throw new TokenException(ErrorType.INVALID_RECIPIENT, "接收方不能为空地址");
        }
        if (to.equals(Address.STAKING_RESERVE)) {
            throw new TokenException(ErrorType.INVALID_RECIPIENT, "接收方不能为质押托管地址");
        }
    }
}
