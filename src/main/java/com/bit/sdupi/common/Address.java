package com.bit.sdupi.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * 账户地址封装（20字节），文本形式为 0x + 40位十六进制，统一小写
 */
@EqualsAndHashCode
public final class Address {
    public static final int LENGTH = 20;
    private static final String PREFIX = "0x";

    /**
     * 空地址：不可作为接收方
     */
    public static final Address NULL = fromBytes(new byte[LENGTH]);

    /**
     * 质押托管地址：质押本金存放处，余额恒等于质押池总质押量
     */
    public static final Address STAKING_RESERVE = of("0x000000000000000000000000000000000000057a");

    private final byte[] value;

    private Address(byte[] value) {
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节");
        }
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    @JsonCreator
    public static Address of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("地址不能为空");
        }
        String hex = text.trim();
        if (hex.startsWith(PREFIX) || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("地址长度非法: " + text);
        }
        try {
            return new Address(Hex.decode(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("地址不是合法的十六进制: " + text, e);
        }
    }

    public boolean isNull() {
        return equals(NULL);
    }

    @JsonValue
    @Override
    public String toString() {
        return PREFIX + Hex.toHexString(value);
    }
}
