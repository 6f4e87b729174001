package com.bit.sdupi.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 代币与质押池创世参数，数量类字段均为整币数量（不含精度）
 */
@Slf4j
@Data
@Component
@Order(0)
@ConfigurationProperties(prefix = "sdupi.token")
public class TokenProperties {
    private String name = "Secure Decentralized Unified Payments Interface";
    private String symbol = "SDUPI";
    private int decimals = 18;
    private String owner;//合约所有者地址，创世代币全部归属该地址
    private BigInteger genesisSupply = new BigInteger("100000000000");//1000亿
    private BigInteger minStake = BigInteger.valueOf(1_000_000L);
    private BigInteger maxStake = BigInteger.valueOf(10_000_000_000L);
    private long apyPercent = 15;
    private long lockPeriod = 30L * 24 * 3600;//30天（秒）
    private boolean stakingActive = true;
    private long replayCacheSize = 1_000_000;//已处理操作ID缓存容量
    private long replayTtlSeconds = 600;//已处理操作ID保留时长
    private int eventLogCapacity = 100_000;//事件日志保留条数，超出后淘汰最早的事件

    @PostConstruct
    public void init() {
        if (owner == null || owner.isBlank()) {
            throw new IllegalStateException("未配置 sdupi.token.owner");
        }
        log.info("代币配置: {}({}), 精度: {}, 创世供应: {}, APY: {}%, 锁定期: {}s",
                name, symbol, decimals, genesisSupply, apyPercent, lockPeriod);
    }

    /**
     * 整币数量换算为最小单位
     */
    public BigInteger toUnits(BigInteger wholeTokens) {
        return wholeTokens.multiply(BigInteger.TEN.pow(decimals));
    }
}
