package com.bit.unchained.structure.payload;

import com.bit.unchained.error.StakingException;

import java.math.BigInteger;
import java.util.List;

final class PayloadChecks {

    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

    private PayloadChecks() {
    }

    static void notNull(Object value, String field) {
        if (value == null) {
            throw StakingException.forbidden("字段不能为空: " + field);
        }
    }

    static void uint256(BigInteger value, String field) {
        notNull(value, field);
        if (value.signum() < 0 || value.compareTo(UINT256_LIMIT) >= 0) {
            throw StakingException.forbidden("字段超出uint256范围: " + field + "=" + value);
        }
    }

    static void uint256List(List<BigInteger> values, String field) {
        notNull(values, field);
        for (BigInteger value : values) {
            uint256(value, field);
        }
    }

    static void idList(List<Long> ids, String field) {
        notNull(ids, field);
        for (Long id : ids) {
            if (id == null || id < 0) {
                throw StakingException.forbidden("非法的NFT编号: " + field + "=" + id);
            }
        }
    }
}
