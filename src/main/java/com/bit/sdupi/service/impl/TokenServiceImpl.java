package com.bit.sdupi.service.impl;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.config.TokenProperties;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.OperationReceipt;
import com.bit.sdupi.core.TokenCore;
import com.bit.sdupi.core.TokenEvent;
import com.bit.sdupi.core.TokenException;
import com.bit.sdupi.core.TokenOperation;
import com.bit.sdupi.result.Result;
import com.bit.sdupi.service.TokenService;
import com.bit.sdupi.staking.dto.StakingInfo;
import com.bit.sdupi.staking.dto.StakingPoolInfo;
import com.bit.sdupi.structure.dto.TokenInfo;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class TokenServiceImpl implements TokenService {

    // 单次事件查询上限
    private static final int MAX_EVENT_PAGE = 1000;

    @Autowired
    private TokenCore tokenCore;

    @Autowired
    private TokenProperties properties;

    /**
     * 已处理操作ID缓存：过期后自动清理
     * Key：requestId，Value：占位
     */
    private Cache<String, Boolean> processedRequests;

    @PostConstruct
    public void init() {
        processedRequests = Caffeine.newBuilder()
                .maximumSize(properties.getReplayCacheSize())
                .expireAfterWrite(properties.getReplayTtlSeconds(), TimeUnit.SECONDS)
                .recordStats()
                .build();
    }

    @Override
    public Result<TokenInfo> getTokenInfo() {
        return Result.OK(tokenCore.getTokenInfo());
    }

    @Override
    public Result<BigInteger> balanceOf(String address) {
        try {
            return Result.OK(tokenCore.balanceOf(Address.of(address)));
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
    }

    @Override
    public Result<BigInteger> allowance(String owner, String spender) {
        try {
            return Result.OK(tokenCore.allowance(Address.of(owner), Address.of(spender)));
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
    }

    @Override
    public Result<StakingInfo> getStakingInfo(String address) {
        try {
            return Result.OK(tokenCore.getStakingInfo(Address.of(address)));
        } catch (IllegalArgumentException e) {
            return invalid(e);
        }
    }

    @Override
    public Result<StakingPoolInfo> getStakingPoolInfo() {
        return Result.OK(tokenCore.getStakingPoolInfo());
    }

    @Override
    public Result<List<TokenEvent>> getEvents(long fromSequence, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_EVENT_PAGE));
        return Result.OK(tokenCore.getEvents(fromSequence, size));
    }

    @Override
    public Result<OperationReceipt> submit(String requestId, TokenOperation operation) {
        boolean tracked = requestId != null && !requestId.isBlank();
        if (tracked && processedRequests.asMap().putIfAbsent(requestId, Boolean.TRUE) != null) {
            log.warn("重复提交的操作: {}", requestId);
            return Result.error(new TokenException(ErrorType.DUPLICATE_OPERATION, "requestId=" + requestId));
        }
        try {
            OperationReceipt receipt = tokenCore.execute(operation);
            log.info("操作执行成功: type={}, caller={}, requestId={}",
                    receipt.getType(), receipt.getCaller(), requestId);
            return Result.OK(receipt);
        } catch (TokenException e) {
            if (tracked) {
                processedRequests.invalidate(requestId);
            }
            log.warn("操作被拒绝: type={}, caller={}, 原因={}",
                    operation == null ? null : operation.getType(),
                    operation == null ? null : operation.getCaller(), e.getMessage());
            return Result.error(e);
        } catch (RuntimeException e) {
            // 非业务异常（如质押回调失败）同样释放ID，允许重试
            if (tracked) {
                processedRequests.invalidate(requestId);
            }
            log.error("操作执行异常: type={}, requestId={}",
                    operation == null ? null : operation.getType(), requestId, e);
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("清理操作ID缓存，统计: {}", processedRequests.stats());
        processedRequests.invalidateAll();
    }

    private static <T> Result<T> invalid(IllegalArgumentException e) {
        return Result.error(new TokenException(ErrorType.INVALID_OPERATION, e.getMessage(), e));
    }
}
