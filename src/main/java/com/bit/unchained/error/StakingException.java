package com.bit.unchained.error;

import java.math.BigInteger;

/**
 * 共识引擎统一异常：封装错误类型，行级错误额外携带失败行下标（以及nonce）
 */
public class StakingException extends RuntimeException {

    private final ErrorType errorType;
    // 批量投票中失败的行下标，非行级错误为null
    private final Integer index;
    // 仅 NONCE_USED 携带
    private final BigInteger nonce;

    public StakingException(ErrorType errorType, String message) {
        this(errorType, message, null, null, null);
    }

    public StakingException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, null, null, cause);
    }

    private StakingException(ErrorType errorType, String message, Integer index, BigInteger nonce, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
        this.index = index;
        this.nonce = nonce;
    }

    public static StakingException of(ErrorType errorType) {
        return new StakingException(errorType, errorType.name());
    }

    public static StakingException atRow(ErrorType errorType, int index) {
        return new StakingException(errorType, errorType.name() + " 行=" + index, index, null, null);
    }

    public static StakingException nonceUsed(int index, BigInteger nonce) {
        return new StakingException(ErrorType.NONCE_USED, "行=" + index + " nonce=" + nonce, index, nonce, null);
    }

    public static StakingException forbidden(String message) {
        return new StakingException(ErrorType.FORBIDDEN, message);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Integer getIndex() {
        return index;
    }

    public BigInteger getNonce() {
        return nonce;
    }
}
