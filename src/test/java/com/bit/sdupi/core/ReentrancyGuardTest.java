package com.bit.sdupi.core;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.staking.StakeRecord;
import com.bit.sdupi.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.bit.sdupi.support.TokenCores.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReentrancyGuardTest {

    private MutableClock clock;
    private TokenCore core;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        core = create(clock);
        core.transfer(OWNER, ALICE, tokens(2_000_000));
    }

    @Test
    void unstakeFromStakeCallbackIsRejected() {
        AtomicReference<TokenException> nested = new AtomicReference<>();
        core.addHook(new StakingHook() {
            @Override
            public void onStaked(TokenCore c, StakeRecord record) {
                try {
                    c.unstake(record.getStaker());
                } catch (TokenException e) {
                    nested.set(e);
                }
            }
        });

        core.stake(ALICE, tokens(1_000_000));

        assertNotNull(nested.get());
        assertEquals(ErrorType.REENTRANCY_DETECTED, nested.get().getErrorType());
        assertTrue(core.getStakingInfo(ALICE).isStaked());
        assertEquals(tokens(1_000_000), core.escrowedPrincipal());
    }

    @Test
    void everyMutationIsRejectedWhileGuardIsRaised() {
        List<ErrorType> errors = new ArrayList<>();
        core.addHook(new StakingHook() {
            @Override
            public void onStaked(TokenCore c, StakeRecord record) {
                List<Runnable> attempts = List.of(
                        () -> c.transfer(ALICE, BOB, BigInteger.ONE),
                        () -> c.burn(ALICE, BigInteger.ONE),
                        () -> c.mint(OWNER, BOB, BigInteger.ONE),
                        () -> c.claimRewards(ALICE),
                        () -> c.stake(BOB, tokens(1_000_000)),
                        () -> c.pause(OWNER));
                for (Runnable attempt : attempts) {
                    try {
                        attempt.run();
                    } catch (TokenException e) {
                        errors.add(e.getErrorType());
                    }
                }
                // 只读查询不受影响
                assertEquals(tokens(1_000_000), c.balanceOf(ALICE));
            }
        });

        core.stake(ALICE, tokens(1_000_000));

        assertEquals(6, errors.size());
        assertTrue(errors.stream().allMatch(ErrorType.REENTRANCY_DETECTED::equals));
        assertFalse(core.isPaused());
        assertEquals(BigInteger.ZERO, core.balanceOf(BOB));
    }

    @Test
    void failingCallbackRollsBackWholeOperation() {
        core.addHook(new StakingHook() {
            @Override
            public void onStaked(TokenCore c, StakeRecord record) {
                c.unstake(record.getStaker());
            }
        });
        int eventsBefore = core.getEvents(0, 100).size();
        BigInteger supplyBefore = core.totalSupply();

        assertError(ErrorType.REENTRANCY_DETECTED, () -> core.stake(ALICE, tokens(1_000_000)));

        assertEquals(tokens(2_000_000), core.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, core.escrowedPrincipal());
        assertEquals(BigInteger.ZERO, core.getStakingPoolInfo().getTotalStaked());
        assertFalse(core.getStakingInfo(ALICE).isStaked());
        assertEquals(supplyBefore, core.totalSupply());
        assertEquals(eventsBefore, core.getEvents(0, 100).size());

        // 守卫已释放，后续操作正常
        core.transfer(ALICE, BOB, tokens(1));
        assertEquals(tokens(1), core.balanceOf(BOB));
    }

    @Test
    void failingClaimCallbackRestoresSnapshotAndRewards() {
        core.stake(ALICE, tokens(1_000_000));
        clock.advanceSeconds(30 * DAY);
        core.addHook(new StakingHook() {
            @Override
            public void onRewardClaimed(TokenCore c, Address account, BigInteger reward) {
                throw new IllegalStateException("下游处理失败");
            }
        });
        BigInteger pending = core.getStakingInfo(ALICE).getCurrentReward();
        BigInteger supplyBefore = core.totalSupply();

        assertThrows(IllegalStateException.class, () -> core.claimRewards(ALICE));

        assertEquals(pending, core.getStakingInfo(ALICE).getCurrentReward());
        assertEquals(supplyBefore, core.totalSupply());
        assertEquals(BigInteger.ZERO, core.getStakingPoolInfo().getTotalRewardsPaid());
        assertEquals(tokens(1_000_000), core.balanceOf(ALICE));
    }

    @Test
    void unstakeCallbackSeesSettledState() {
        AtomicReference<BigInteger> seen = new AtomicReference<>();
        core.addHook(new StakingHook() {
            @Override
            public void onUnstaked(TokenCore c, StakeRecord record, BigInteger reward) {
                seen.set(c.balanceOf(record.getStaker()));
            }
        });
        core.stake(ALICE, tokens(1_000_000));
        clock.advanceSeconds(LOCK_PERIOD);
        core.unstake(ALICE);

        assertEquals(core.balanceOf(ALICE), seen.get());
    }
}
