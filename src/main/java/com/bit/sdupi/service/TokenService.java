package com.bit.sdupi.service;

import com.bit.sdupi.core.OperationReceipt;
import com.bit.sdupi.core.TokenEvent;
import com.bit.sdupi.core.TokenOperation;
import com.bit.sdupi.result.Result;
import com.bit.sdupi.staking.dto.StakingInfo;
import com.bit.sdupi.staking.dto.StakingPoolInfo;
import com.bit.sdupi.structure.dto.TokenInfo;

import java.math.BigInteger;
import java.util.List;

public interface TokenService {

    Result<TokenInfo> getTokenInfo();

    Result<BigInteger> balanceOf(String address);

    Result<BigInteger> allowance(String owner, String spender);

    Result<StakingInfo> getStakingInfo(String address);

    Result<StakingPoolInfo> getStakingPoolInfo();

    Result<List<TokenEvent>> getEvents(long fromSequence, int limit);

    /**
     * 提交一笔类型化操作
     * @param requestId 调用方生成的唯一ID，重复提交直接拒绝；为空则不做重放检查
     */
    Result<OperationReceipt> submit(String requestId, TokenOperation operation);
}
