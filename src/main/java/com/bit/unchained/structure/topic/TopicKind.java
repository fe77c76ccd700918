package com.bit.unchained.structure.topic;

public enum TopicKind {
    TRANSFER("资产转移"),
    PARAMS("参数变更"),
    PRICE_UPDATE("价格更新");

    private final String desc;

    TopicKind(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
