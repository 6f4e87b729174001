package com.bit.sdupi.config;

import com.bit.sdupi.access.AccessControl;
import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.TokenCore;
import com.bit.sdupi.ledger.Ledger;
import com.bit.sdupi.ledger.impl.LedgerImpl;
import com.bit.sdupi.staking.StakeBook;
import com.bit.sdupi.staking.StakingPool;
import com.bit.sdupi.staking.impl.StakeBookImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 核心实例装配：所有者与暂停标志由单个 TokenCore 实例持有，不使用全局静态状态
 */
@Slf4j
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCore tokenCore(TokenProperties properties, Clock clock) {
        Address owner = Address.of(properties.getOwner());
        Ledger ledger = new LedgerImpl(owner, properties.toUnits(properties.getGenesisSupply()));
        StakingPool pool = new StakingPool(properties.getApyPercent(), properties.getLockPeriod(),
                properties.isStakingActive());
        StakeBook stakeBook = new StakeBookImpl(ledger, pool,
                properties.toUnits(properties.getMinStake()), properties.toUnits(properties.getMaxStake()));
        TokenCore core = new TokenCore(properties.getName(), properties.getSymbol(), properties.getDecimals(),
                ledger, stakeBook, new AccessControl(owner), clock, properties.getEventLogCapacity());
        log.info("代币核心创建完成，所有者: {}", owner);
        return core;
    }
}
