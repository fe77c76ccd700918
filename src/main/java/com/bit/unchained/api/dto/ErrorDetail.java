package com.bit.unchained.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 错误详情：错误名、失败行下标、nonce（后两者按错误类型可为空）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorDetail {
    private String error;
    private Integer index;
    private BigInteger nonce;
}
