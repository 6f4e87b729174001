package com.bit.sdupi.api;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.OperationReceipt;
import com.bit.sdupi.core.OperationType;
import com.bit.sdupi.core.TokenEvent;
import com.bit.sdupi.core.TokenOperation;
import com.bit.sdupi.result.Result;
import com.bit.sdupi.service.TokenService;
import com.bit.sdupi.structure.dto.TokenInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * 代币接口：金额均为最小单位（18位精度）
 */
@Slf4j
@RestController
@RequestMapping("/token")
public class TokenApi {

    @Autowired
    private TokenService tokenService;

    // 代币元数据
    @GetMapping("/info")
    public Result<TokenInfo> info() {
        return tokenService.getTokenInfo();
    }

    // 查询余额
    @GetMapping("/balance")
    public Result<BigInteger> balance(@RequestParam("address") String address) {
        return tokenService.balanceOf(address);
    }

    // 查询授权额度
    @GetMapping("/allowance")
    public Result<BigInteger> allowance(@RequestParam("owner") String owner,
                                        @RequestParam("spender") String spender) {
        return tokenService.allowance(owner, spender);
    }

    // 事件日志
    @GetMapping("/events")
    public Result<List<TokenEvent>> events(@RequestParam(value = "from", defaultValue = "0") long from,
                                           @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return tokenService.getEvents(from, limit);
    }

    @PostMapping("/transfer")
    public Result<OperationReceipt> transfer(@RequestParam("from") String from,
                                             @RequestParam("to") String to,
                                             @RequestParam("amount") BigInteger amount,
                                             @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.TRANSFER)
                .caller(Address.of(from))
                .target(Address.of(to))
                .amount(amount)
                .build());
    }

    @PostMapping("/approve")
    public Result<OperationReceipt> approve(@RequestParam("owner") String owner,
                                            @RequestParam("spender") String spender,
                                            @RequestParam("amount") BigInteger amount,
                                            @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.APPROVE)
                .caller(Address.of(owner))
                .spender(Address.of(spender))
                .amount(amount)
                .build());
    }

    @PostMapping("/transferFrom")
    public Result<OperationReceipt> transferFrom(@RequestParam("spender") String spender,
                                                 @RequestParam("from") String from,
                                                 @RequestParam("to") String to,
                                                 @RequestParam("amount") BigInteger amount,
                                                 @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.TRANSFER_FROM)
                .caller(Address.of(spender))
                .from(Address.of(from))
                .target(Address.of(to))
                .amount(amount)
                .build());
    }

    @PostMapping("/burn")
    public Result<OperationReceipt> burn(@RequestParam("holder") String holder,
                                         @RequestParam("amount") BigInteger amount,
                                         @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, TokenOperation.builder()
                .type(OperationType.BURN)
                .caller(Address.of(holder))
                .amount(amount)
                .build());
    }

    /**
     * 提交一笔类型化操作（JSON），适用于所有操作类型
     */
    @PostMapping("/submit")
    public Result<OperationReceipt> submit(@RequestBody TokenOperation operation,
                                           @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return tokenService.submit(requestId, operation);
    }
}
