package com.bit.sdupi.access;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenCore;
import com.bit.sdupi.core.TokenEventType;
import com.bit.sdupi.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.bit.sdupi.support.TokenCores.*;
import static org.junit.jupiter.api.Assertions.*;

public class AccessControlTest {

    private MutableClock clock;
    private TokenCore core;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        core = create(clock);
        core.transfer(OWNER, ALICE, tokens(3_000_000));
    }

    @Test
    void pauseBlocksTransfersForEveryAccountButNotOwnerMint() {
        core.pause(OWNER);
        assertTrue(core.isPaused());

        assertError(ErrorType.SYSTEM_PAUSED, () -> core.transfer(ALICE, BOB, tokens(1)));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.transfer(OWNER, BOB, tokens(1)));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.transferFrom(BOB, ALICE, CAROL, tokens(1)));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.approve(ALICE, BOB, tokens(1)));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.burn(ALICE, tokens(1)));

        core.mint(OWNER, BOB, tokens(7));
        assertEquals(tokens(7), core.balanceOf(BOB));

        core.unpause(OWNER);
        core.transfer(ALICE, BOB, tokens(1));
        assertEquals(tokens(8), core.balanceOf(BOB));
    }

    @Test
    void pauseBlocksStakingOperations() {
        core.stake(ALICE, tokens(1_000_000));
        clock.advanceSeconds(LOCK_PERIOD);
        core.pause(OWNER);

        assertError(ErrorType.SYSTEM_PAUSED, () -> core.stake(ALICE, tokens(1_000_000)));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.claimRewards(ALICE));
        assertError(ErrorType.SYSTEM_PAUSED, () -> core.unstake(ALICE));
        assertTrue(core.getStakingInfo(ALICE).isStaked());

        core.unpause(OWNER);
        core.unstake(ALICE);
    }

    @Test
    void adminOperationsWorkWhilePaused() {
        core.pause(OWNER);
        core.updateStakingPool(OWNER, 12, DAY);
        core.setStakingActive(OWNER, false);
        assertEquals(12, core.getStakingPoolInfo().getApyPercent());
        assertFalse(core.getStakingPoolInfo().isActive());
    }

    @Test
    void onlyOwnerCanPauseAndUnpause() {
        assertError(ErrorType.UNAUTHORIZED, () -> core.pause(ALICE));
        assertFalse(core.isPaused());
        core.pause(OWNER);
        assertError(ErrorType.UNAUTHORIZED, () -> core.unpause(ALICE));
        assertTrue(core.isPaused());
    }

    @Test
    void ownershipHandover() {
        assertError(ErrorType.UNAUTHORIZED, () -> core.transferOwnership(ALICE, ALICE));
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.transferOwnership(OWNER, Address.NULL));

        core.transferOwnership(OWNER, BOB);
        assertEquals(BOB, core.owner());

        assertError(ErrorType.UNAUTHORIZED, () -> core.mint(OWNER, ALICE, tokens(1)));
        core.mint(BOB, ALICE, tokens(1));
        assertEquals(tokens(3_000_001), core.balanceOf(ALICE));

        TokenEventType last = core.getEvents(0, 100).get(core.getEvents(0, 100).size() - 1).getType();
        assertEquals(TokenEventType.MINT, last);
    }

    @Test
    void ownerIsRequiredAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new AccessControl(Address.NULL));
        assertThrows(IllegalArgumentException.class, () -> new AccessControl(null));
    }

    @Test
    void pauseFlagIndependentOfOwner() {
        AccessControl access = new AccessControl(OWNER);
        access.pause(OWNER);
        access.transferOwnership(OWNER, BOB);
        assertTrue(access.isPaused());
        access.unpause(BOB);
        assertFalse(access.isPaused());
        assertEquals(BigInteger.ZERO, core.balanceOf(BOB));
    }
}
