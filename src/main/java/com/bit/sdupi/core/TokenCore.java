package com.bit.sdupi.core;

import com.bit.sdupi.access.AccessControl;
import com.bit.sdupi.common.Address;
import com.bit.sdupi.ledger.Ledger;
import com.bit.sdupi.ledger.LedgerState;
import com.bit.sdupi.staking.StakeBook;
import com.bit.sdupi.staking.StakeBookState;
import com.bit.sdupi.staking.StakeRecord;
import com.bit.sdupi.staking.StakingPool;
import com.bit.sdupi.staking.dto.StakingInfo;
import com.bit.sdupi.staking.dto.StakingPoolInfo;
import com.bit.sdupi.structure.dto.TokenInfo;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 代币与质押核心：单写者状态机
 * 1. 全局锁：所有状态（余额、质押记录、质押池、权限）共用一把锁，每个变更操作整体执行完毕才释放
 * 2. 重入保护：stake/unstake/claimRewards 执行期间置位，期间进入的任何变更调用直接失败
 * 3. 原子性：先校验全部前置条件再修改状态；回调抛出异常时按快照整体回滚
 */
@Slf4j
public class TokenCore {

    @Getter
    private final String name;
    @Getter
    private final String symbol;
    @Getter
    private final int decimals;

    private final Ledger ledger;
    private final StakeBook stakeBook;
    private final AccessControl access;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // 重入保护标志，只在持锁线程内读写
    private boolean entered;

    // 只保留最近 eventCapacity 条事件，序号全局递增，淘汰后不复用
    private final Deque<TokenEvent> events = new ArrayDeque<>();
    private final int eventCapacity;
    private long nextSequence;
    private final List<StakingHook> hooks = new CopyOnWriteArrayList<>();

    public TokenCore(String name, String symbol, int decimals,
                     Ledger ledger, StakeBook stakeBook, AccessControl access, Clock clock,
                     int eventCapacity) {
        if (eventCapacity <= 0) {
            throw new IllegalArgumentException("事件日志容量必须为正数: " + eventCapacity);
        }
        this.eventCapacity = eventCapacity;
        this.name = name;
        this.symbol = symbol;
        this.decimals = decimals;
        this.ledger = ledger;
        this.stakeBook = stakeBook;
        this.access = access;
        this.clock = clock;
    }

    public void addHook(StakingHook hook) {
        hooks.add(hook);
    }

    // ========== 账本操作 ==========

    public void transfer(Address caller, Address to, BigInteger amount) {
        write(() -> {
            access.requireNotPaused();
            requireAccount(caller);
            ledger.transfer(caller, to, amount);
            emit(TokenEventType.TRANSFER, caller, to, amount);
            return null;
        });
    }

    public void transferFrom(Address spender, Address from, Address to, BigInteger amount) {
        write(() -> {
            access.requireNotPaused();
            requireAccount(spender);
            requireAccount(from);
            ledger.transferFrom(spender, from, to, amount);
            emit(TokenEventType.TRANSFER, from, to, amount);
            return null;
        });
    }

    public void approve(Address owner, Address spender, BigInteger amount) {
        write(() -> {
            access.requireNotPaused();
            requireAccount(owner);
            ledger.approve(owner, spender, amount);
            emit(TokenEventType.APPROVAL, owner, spender, amount);
            return null;
        });
    }

    /**
     * 所有者增发，暂停期间仍然允许
     */
    public void mint(Address caller, Address to, BigInteger amount) {
        write(() -> {
            access.requireOwner(caller);
            ledger.mint(to, amount);
            emit(TokenEventType.MINT, null, to, amount);
            return null;
        });
    }

    public void burn(Address caller, BigInteger amount) {
        write(() -> {
            access.requireNotPaused();
            requireAccount(caller);
            ledger.burn(caller, amount);
            emit(TokenEventType.BURN, caller, null, amount);
            return null;
        });
    }

    // ========== 质押操作 ==========

    public StakeRecord stake(Address account, BigInteger amount) {
        return guarded(() -> {
            access.requireNotPaused();
            requireAccount(account);
            StakeRecord record = stakeBook.stake(account, amount, now());
            emit(TokenEventType.STAKED, account, Address.STAKING_RESERVE, amount);
            for (StakingHook hook : hooks) {
                hook.onStaked(this, record.copy());
            }
            log.info("质押成功: 账户={}, 数量={}, 锁定至={}", account, amount, record.getLockEndTime());
            return record;
        });
    }

    public StakeBook.Settlement unstake(Address account) {
        return guarded(() -> {
            access.requireNotPaused();
            requireAccount(account);
            StakeBook.Settlement settlement = stakeBook.unstake(account, now());
            StakeRecord record = settlement.getRecord();
            emit(TokenEventType.UNSTAKED, Address.STAKING_RESERVE, account, record.getAmount());
            if (settlement.getReward().signum() > 0) {
                emit(TokenEventType.REWARD_CLAIMED, null, account, settlement.getReward());
            }
            for (StakingHook hook : hooks) {
                hook.onUnstaked(this, record.copy(), settlement.getReward());
            }
            log.info("解除质押: 账户={}, 本金={}, 奖励={}", account, record.getAmount(), settlement.getReward());
            return settlement;
        });
    }

    public BigInteger claimRewards(Address account) {
        return guarded(() -> {
            access.requireNotPaused();
            requireAccount(account);
            BigInteger reward = stakeBook.claimRewards(account, now());
            emit(TokenEventType.REWARD_CLAIMED, null, account, reward);
            for (StakingHook hook : hooks) {
                hook.onRewardClaimed(this, account, reward);
            }
            log.info("领取奖励: 账户={}, 奖励={}", account, reward);
            return reward;
        });
    }

    // ========== 管理操作 ==========

    /**
     * 调整质押池参数：锁定期只影响新质押，APY 立即作用于所有未领取区间
     */
    public void updateStakingPool(Address caller, long apyPercent, long lockPeriod) {
        write(() -> {
            access.requireOwner(caller);
            if (apyPercent < 0 || lockPeriod < 0) {
                throw new TokenException(ErrorType.INVALID_AMOUNT,
                        "APY 与锁定期不能为负: apy=" + apyPercent + ", lockPeriod=" + lockPeriod);
            }
            StakingPool pool = stakeBook.getPool();
            pool.setApyPercent(apyPercent);
            pool.setLockPeriod(lockPeriod);
            emit(TokenEventType.POOL_UPDATED, caller, null, BigInteger.valueOf(apyPercent));
            log.info("质押池参数更新: apy={}%, lockPeriod={}s", apyPercent, lockPeriod);
            return null;
        });
    }

    public void setStakingActive(Address caller, boolean active) {
        write(() -> {
            access.requireOwner(caller);
            stakeBook.getPool().setActive(active);
            emit(TokenEventType.STAKING_STATUS, caller, null, active ? BigInteger.ONE : BigInteger.ZERO);
            log.info("质押池状态: {}", active ? "开放" : "关闭");
            return null;
        });
    }

    public void pause(Address caller) {
        write(() -> {
            access.pause(caller);
            emit(TokenEventType.PAUSED, caller, null, null);
            log.info("系统已暂停，操作人: {}", caller);
            return null;
        });
    }

    public void unpause(Address caller) {
        write(() -> {
            access.unpause(caller);
            emit(TokenEventType.UNPAUSED, caller, null, null);
            log.info("系统已恢复，操作人: {}", caller);
            return null;
        });
    }

    public void transferOwnership(Address caller, Address newOwner) {
        write(() -> {
            Address previous = access.transferOwnership(caller, newOwner);
            emit(TokenEventType.OWNERSHIP_TRANSFERRED, previous, newOwner, null);
            return null;
        });
    }

    // ========== 类型化操作入口 ==========

    public OperationReceipt execute(TokenOperation op) {
        if (op == null || op.getType() == null || op.getCaller() == null) {
            throw new TokenException(ErrorType.INVALID_OPERATION, "操作类型与调用方不能为空");
        }
        Address caller = op.getCaller();
        BigInteger amount = op.getAmount();
        BigInteger reward = null;
        switch (op.getType()) {
            case TRANSFER:
                transfer(caller, op.getTarget(), requireField(amount, "amount"));
                break;
            case TRANSFER_FROM:
                transferFrom(caller, requireField(op.getFrom(), "from"), op.getTarget(),
                        requireField(amount, "amount"));
                break;
            case APPROVE:
                approve(caller, op.getSpender(), requireField(amount, "amount"));
                break;
            case MINT:
                mint(caller, op.getTarget(), requireField(amount, "amount"));
                break;
            case BURN:
                burn(caller, requireField(amount, "amount"));
                break;
            case STAKE:
                stake(caller, requireField(amount, "amount"));
                break;
            case UNSTAKE:
                StakeBook.Settlement settlement = unstake(caller);
                amount = settlement.getRecord().getAmount();
                reward = settlement.getReward();
                break;
            case CLAIM_REWARDS:
                reward = claimRewards(caller);
                break;
            case UPDATE_POOL:
                updateStakingPool(caller, requireField(op.getApyPercent(), "apyPercent"),
                        requireField(op.getLockPeriod(), "lockPeriod"));
                break;
            case SET_STAKING_ACTIVE:
                setStakingActive(caller, requireField(op.getActive(), "active"));
                break;
            case PAUSE:
                pause(caller);
                break;
            case UNPAUSE:
                unpause(caller);
                break;
            case TRANSFER_OWNERSHIP:
                transferOwnership(caller, op.getTarget());
                break;
            default:
                throw new TokenException(ErrorType.INVALID_OPERATION, "未知操作类型: " + op.getType());
        }
        return new OperationReceipt(op.getType(), caller, amount, reward, now());
    }

    // ========== 只读查询 ==========

    public BigInteger balanceOf(Address account) {
        return read(() -> ledger.balanceOf(account));
    }

    public BigInteger totalSupply() {
        return read(ledger::totalSupply);
    }

    public BigInteger allowance(Address owner, Address spender) {
        return read(() -> ledger.allowance(owner, spender));
    }

    /**
     * 托管中的质押本金
     */
    public BigInteger escrowedPrincipal() {
        return read(() -> ledger.balanceOf(Address.STAKING_RESERVE));
    }

    public StakingInfo getStakingInfo(Address account) {
        return read(() -> {
            StakeRecord record = stakeBook.getRecord(account);
            if (record == null || !record.isActive()) {
                return StakingInfo.empty();
            }
            return new StakingInfo(record.getAmount(), record.getStartTime(), record.getLockEndTime(),
                    stakeBook.pendingReward(account, now()), true);
        });
    }

    public StakingPoolInfo getStakingPoolInfo() {
        return read(() -> {
            StakingPool pool = stakeBook.getPool();
            return new StakingPoolInfo(pool.getTotalStaked(), pool.getTotalRewardsPaid(),
                    pool.getApyPercent(), pool.getLockPeriod(), pool.isActive());
        });
    }

    public TokenInfo getTokenInfo() {
        return read(() -> new TokenInfo(name, symbol, decimals, ledger.totalSupply(),
                access.getOwner(), access.isPaused()));
    }

    public Address owner() {
        return read(access::getOwner);
    }

    public boolean isPaused() {
        return read(access::isPaused);
    }

    /**
     * 已淘汰的序号不再返回，从仍保留的最早一条开始
     * @param fromSequence 起始序号（包含）
     * @param limit 最大条数
     */
    public List<TokenEvent> getEvents(long fromSequence, int limit) {
        return read(() -> {
            List<TokenEvent> page = new ArrayList<>();
            Iterator<TokenEvent> it = events.iterator();
            while (it.hasNext() && page.size() < limit) {
                TokenEvent event = it.next();
                if (event.getSequence() >= fromSequence) {
                    page.add(event);
                }
            }
            return page;
        });
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }

    // ========== 内部 ==========

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.lock();
        try {
            rejectReentry();
            long eventMark = nextSequence;
            try {
                T result = action.get();
                evictEvents();
                return result;
            } catch (RuntimeException e) {
                truncateEvents(eventMark);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> T guarded(Supplier<T> action) {
        lock.lock();
        try {
            rejectReentry();
            entered = true;
            long eventMark = nextSequence;
            LedgerState ledgerState = hooks.isEmpty() ? null : ledger.snapshot();
            StakeBookState stakeState = hooks.isEmpty() ? null : stakeBook.snapshot();
            try {
                T result = action.get();
                evictEvents();
                return result;
            } catch (RuntimeException e) {
                if (ledgerState != null) {
                    ledger.restore(ledgerState);
                    stakeBook.restore(stakeState);
                    log.warn("质押操作回滚: {}", e.getMessage());
                }
                truncateEvents(eventMark);
                throw e;
            } finally {
                entered = false;
            }
        } finally {
            lock.unlock();
        }
    }

    private void rejectReentry() {
        if (entered) {
            throw new TokenException(ErrorType.REENTRANCY_DETECTED, "质押操作执行中，拒绝嵌套调用");
        }
    }

    // 回滚本次操作产生的事件；淘汰只在提交后进行，所以这里不会碰到旧事件
    private void truncateEvents(long mark) {
        while (nextSequence > mark) {
            events.pollLast();
            nextSequence--;
        }
    }

    private void evictEvents() {
        while (events.size() > eventCapacity) {
            events.pollFirst();
        }
    }

    private void emit(TokenEventType type, Address from, Address to, BigInteger amount) {
        events.addLast(new TokenEvent(nextSequence++, type, from, to, amount, now()));
    }

    private static void requireAccount(Address account) {
        if (account == null) {
            throw new TokenException(ErrorType.INVALID_OPERATION, "调用方不能为空");
        }
        if (Address.STAKING_RESERVE.equals(account)) {
            throw new TokenException(ErrorType.UNAUTHORIZED, "质押托管地址不能直接发起操作");
        }
    }

    private static <T> T requireField(T value, String field) {
        if (value == null) {
            throw new TokenException(ErrorType.INVALID_OPERATION, "缺少字段: " + field);
        }
        return value;
    }
}
