package com.bit.sdupi.ledger;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenCore;
import com.bit.sdupi.core.TokenEvent;
import com.bit.sdupi.core.TokenEventType;
import com.bit.sdupi.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.bit.sdupi.support.TokenCores.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LedgerTest {

    private TokenCore core;

    @BeforeEach
    void setUp() {
        core = create(new MutableClock(T0));
    }

    @Test
    void genesisMintsFullSupplyToOwner() {
        BigInteger genesis = new BigInteger("100000000000000000000000000000");
        assertEquals(genesis, core.totalSupply());
        assertEquals(genesis, core.balanceOf(OWNER));
        assertEquals(18, core.getTokenInfo().getDecimals());
        assertEquals("SDUPI", core.getTokenInfo().getSymbol());
    }

    @Test
    void transferMovesBalance() {
        core.transfer(OWNER, ALICE, tokens(500));
        core.transfer(ALICE, BOB, tokens(200));

        assertEquals(tokens(300), core.balanceOf(ALICE));
        assertEquals(tokens(200), core.balanceOf(BOB));
        assertEquals(tokens(100_000_000_000L), core.totalSupply());
    }

    @Test
    void transferRejectsInsufficientBalance() {
        core.transfer(OWNER, ALICE, tokens(10));
        assertError(ErrorType.INSUFFICIENT_BALANCE, () -> core.transfer(ALICE, BOB, tokens(11)));
        assertEquals(tokens(10), core.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, core.balanceOf(BOB));
    }

    @Test
    void transferRejectsNullAndReserveRecipients() {
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.transfer(OWNER, Address.NULL, tokens(1)));
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.transfer(OWNER, Address.STAKING_RESERVE, tokens(1)));
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.transfer(OWNER, null, tokens(1)));
    }

    @Test
    void transferRejectsNegativeAmount() {
        assertError(ErrorType.INVALID_AMOUNT, () -> core.transfer(OWNER, ALICE, BigInteger.valueOf(-1)));
    }

    @Test
    void reserveCannotSpend() {
        assertError(ErrorType.UNAUTHORIZED, () -> core.transfer(Address.STAKING_RESERVE, ALICE, BigInteger.ZERO));
        assertError(ErrorType.UNAUTHORIZED, () -> core.burn(Address.STAKING_RESERVE, BigInteger.ZERO));
    }

    @Test
    void mintIsOwnerOnlyAndIncreasesSupply() {
        assertError(ErrorType.UNAUTHORIZED, () -> core.mint(ALICE, ALICE, tokens(1)));

        core.mint(OWNER, ALICE, tokens(42));
        assertEquals(tokens(42), core.balanceOf(ALICE));
        assertEquals(tokens(100_000_000_042L), core.totalSupply());
    }

    @Test
    void mintRejectsZeroAmountAndNullRecipient() {
        assertError(ErrorType.INVALID_AMOUNT, () -> core.mint(OWNER, ALICE, BigInteger.ZERO));
        assertError(ErrorType.INVALID_AMOUNT, () -> core.mint(OWNER, Address.NULL, tokens(1)));
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.mint(OWNER, Address.STAKING_RESERVE, tokens(1)));
        assertEquals(tokens(100_000_000_000L), core.totalSupply());
    }

    @Test
    void burnReducesBalanceAndSupply() {
        core.transfer(OWNER, ALICE, tokens(100));
        core.burn(ALICE, tokens(40));

        assertEquals(tokens(60), core.balanceOf(ALICE));
        assertEquals(tokens(100_000_000_000L).subtract(tokens(40)), core.totalSupply());
        assertError(ErrorType.INSUFFICIENT_BALANCE, () -> core.burn(ALICE, tokens(61)));
    }

    @Test
    void approveAndTransferFromConsumeAllowance() {
        core.transfer(OWNER, ALICE, tokens(100));
        core.approve(ALICE, BOB, tokens(30));
        assertEquals(tokens(30), core.allowance(ALICE, BOB));

        core.transferFrom(BOB, ALICE, CAROL, tokens(20));
        assertEquals(tokens(10), core.allowance(ALICE, BOB));
        assertEquals(tokens(80), core.balanceOf(ALICE));
        assertEquals(tokens(20), core.balanceOf(CAROL));

        assertError(ErrorType.INSUFFICIENT_ALLOWANCE, () -> core.transferFrom(BOB, ALICE, CAROL, tokens(11)));
        assertEquals(tokens(10), core.allowance(ALICE, BOB));
    }

    @Test
    void approveOverwritesPreviousAllowance() {
        core.approve(ALICE, BOB, tokens(30));
        core.approve(ALICE, BOB, tokens(5));
        assertEquals(tokens(5), core.allowance(ALICE, BOB));
        assertError(ErrorType.INVALID_RECIPIENT, () -> core.approve(ALICE, Address.NULL, tokens(1)));
    }

    @Test
    void transferFromChecksBalanceAfterAllowance() {
        core.transfer(OWNER, ALICE, tokens(5));
        core.approve(ALICE, BOB, tokens(30));
        assertError(ErrorType.INSUFFICIENT_BALANCE, () -> core.transferFrom(BOB, ALICE, CAROL, tokens(6)));
        assertEquals(tokens(30), core.allowance(ALICE, BOB));
    }

    @Test
    void eventsAreRecordedOnlyForSuccessfulOperations() {
        core.transfer(OWNER, ALICE, tokens(1));
        assertError(ErrorType.INSUFFICIENT_BALANCE, () -> core.transfer(BOB, ALICE, tokens(1)));
        core.burn(ALICE, tokens(1));

        List<TokenEvent> events = core.getEvents(0, 10);
        assertEquals(2, events.size());
        assertEquals(TokenEventType.TRANSFER, events.get(0).getType());
        assertEquals(TokenEventType.BURN, events.get(1).getType());
        assertEquals(0, events.get(0).getSequence());
        assertEquals(1, events.get(1).getSequence());
        assertEquals(1, core.getEvents(1, 10).size());
    }
}
