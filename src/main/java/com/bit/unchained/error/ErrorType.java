package com.bit.unchained.error;

/**
 * 共识引擎错误类型（封闭集合），code 用于接口层返回
 */
public enum ErrorType {
    AMOUNT_ZERO(4001, "质押数量为零（金额为0且未附带NFT）"),
    DURATION_ZERO(4002, "锁定时长为零"),
    ALREADY_STAKED(4003, "已存在有效质押"),
    STAKE_ZERO(4004, "不存在有效质押"),
    NOT_UNLOCKED(4005, "质押尚未解锁"),
    DELEGATE_ADDRESS_IN_USE(4006, "代理签名地址已被其他质押者占用"),
    ADDRESS_IN_USE(4007, "备用地址已被其他质押者绑定"),
    LENGTH_MISMATCH(4008, "数组长度不一致"),
    NONCE_USED(4009, "nonce已被使用"),
    INVALID_SIGNATURE(4010, "签名无效"),
    VOTING_POWER_ZERO(4011, "投票权为零"),
    TOPIC_EXPIRED(4012, "议题已过期"),
    STAKE_EXPIRES_BEFORE_VOTE(4013, "质押在议题过期前解锁"),
    /**
     * 保留：重复投票按幂等处理直接返回原议题，引擎不抛出此错误
     */
    ALREADY_VOTED(4014, "重复投票"),
    FORBIDDEN(4030, "操作被禁止"),
    WRONG_ASSET(4031, "非预期的资产");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
