package com.bit.sdupi.api;

import com.bit.sdupi.aop.annotation.AdminOperation;
import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.OperationReceipt;
import com.bit.sdupi.core.OperationType;
import com.bit.sdupi.core.TokenOperation;
import com.bit.sdupi.result.Result;
import com.bit.sdupi.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * 所有者管理接口，权限由核心校验，这里只负责审计
 */
@Slf4j
@RestController
@RequestMapping("/admin")
public class AdminApi {

    @Autowired
    private TokenService tokenService;

    @AdminOperation("增发")
    @PostMapping("/mint")
    public Result<OperationReceipt> mint(@RequestParam("caller") String caller,
                                         @RequestParam("to") String to,
                                         @RequestParam("amount") BigInteger amount,
                                         @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.MINT)
                .caller(Address.of(caller))
                .target(Address.of(to))
                .amount(amount)
                .build());
    }

    @AdminOperation("暂停")
    @PostMapping("/pause")
    public Result<OperationReceipt> pause(@RequestParam("caller") String caller,
                                          @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.PAUSE)
                .caller(Address.of(caller))
                .build());
    }

    @AdminOperation("恢复")
    @PostMapping("/unpause")
    public Result<OperationReceipt> unpause(@RequestParam("caller") String caller,
                                            @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.UNPAUSE)
                .caller(Address.of(caller))
                .build());
    }

    @AdminOperation("更新质押池")
    @PostMapping("/pool")
    public Result<OperationReceipt> updatePool(@RequestParam("caller") String caller,
                                               @RequestParam("apyPercent") long apyPercent,
                                               @RequestParam("lockPeriod") long lockPeriod,
                                               @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.UPDATE_POOL)
                .caller(Address.of(caller))
                .apyPercent(apyPercent)
                .lockPeriod(lockPeriod)
                .build());
    }

    @AdminOperation("质押开关")
    @PostMapping("/stakingActive")
    public Result<OperationReceipt> setStakingActive(@RequestParam("caller") String caller,
                                                     @RequestParam("active") boolean active,
                                                     @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.SET_STAKING_ACTIVE)
                .caller(Address.of(caller))
                .active(active)
                .build());
    }

    @AdminOperation("移交所有权")
    @PostMapping("/transferOwnership")
    public Result<OperationReceipt> transferOwnership(@RequestParam("caller") String caller,
                                                      @RequestParam("newOwner") String newOwner,
                                                      @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.TRANSFER_OWNERSHIP)
                .caller(Address.of(caller))
                .target(Address.of(newOwner))
                .build());
    }
}
