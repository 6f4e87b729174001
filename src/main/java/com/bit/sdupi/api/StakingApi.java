package com.bit.sdupi.api;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.OperationReceipt;
import com.bit.sdupi.core.OperationType;
import com.bit.sdupi.core.TokenOperation;
import com.bit.sdupi.result.Result;
import com.bit.sdupi.service.TokenService;
import com.bit.sdupi.staking.dto.StakingInfo;
import com.bit.sdupi.staking.dto.StakingPoolInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@Slf4j
@RestController
@RequestMapping("/staking")
public class StakingApi {

    @Autowired
    private TokenService tokenService;

    // 账户质押信息
    @GetMapping("/info")
    public Result<StakingInfo> info(@RequestParam("address") String address) {
        return tokenService.getStakingInfo(address);
    }

    // 质押池信息
    @GetMapping("/pool")
    public Result<StakingPoolInfo> pool() {
        return tokenService.getStakingPoolInfo();
    }

    @PostMapping("/stake")
    public Result<OperationReceipt> stake(@RequestParam("account") String account,
                                          @RequestParam("amount") BigInteger amount,
                                          @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.STAKE)
                .caller(Address.of(account))
                .amount(amount)
                .build());
    }

    @PostMapping("/unstake")
    public Result<OperationReceipt> unstake(@RequestParam("account") String account,
                                            @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.UNSTAKE)
                .caller(Address.of(account))
                .build());
    }

    @PostMapping("/claim")
    public Result<OperationReceipt> claim(@RequestParam("account") String account,
                                          @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.CLAIM_REWARDS)
                .caller(Address.of(account))
                .build());
    }
}
