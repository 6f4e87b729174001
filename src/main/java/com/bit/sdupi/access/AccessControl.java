package com.bit.sdupi.access;

import com.bit.sdupi.common.Address;
import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenException;
import lombok.extern.slf4j.Slf4j;

/**
 * 权限与暂停状态：所有者在构造时确定，之后只能由当前所有者移交
 * 两个标志相互独立，状态修改由 TokenCore 串行化
 */
@Slf4j
public class AccessControl {

    private Address owner;
    private boolean paused;

    public AccessControl(Address owner) {
        if (owner == null || owner.isNull()) {
            throw new IllegalArgumentException("所有者地址不能为空");
        }
        this.owner = owner;
    }

    public Address getOwner() {
        return owner;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    public void requireOwner(Address caller) {
        if (!isOwner(caller)) {
            throw new TokenException(ErrorType.UNAUTHORIZED, "调用方 " + caller + " 不是所有者");
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new TokenException(ErrorType.SYSTEM_PAUSED, "系统暂停中，拒绝余额变更");
        }
    }

    public void pause(Address caller) {
        requireOwner(caller);
        paused = true;
    }

    public void unpause(Address caller) {
        requireOwner(caller);
        paused = false;
    }

    public Address transferOwnership(Address caller, Address newOwner) {
        requireOwner(caller);
        if (newOwner == null || newOwner.isNull()) {
            throw new TokenException(ErrorType.INVALID_RECIPIENT, "新所有者不能为空地址");
        }
        Address previous = owner;
        owner = newOwner;
        log.info("所有权移交: {} -> {}", previous, newOwner);
        return previous;
    }
}
