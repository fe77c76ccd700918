package com.bit.unchained.voting.effect;

import com.bit.unchained.structure.payload.VotePayload;

/**
 * 议题通过后的效果处理，三类议题共用同一投票流程，只在这里区分
 */
public interface TopicEffect<P extends VotePayload> {

    /**
     * 计算议题键之前的逐行校验
     */
    default void precheck(int row, P payload) {
    }

    /**
     * 议题首次达到阈值时执行且只执行一次
     */
    void apply(int row, P payload);
}
