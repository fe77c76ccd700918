package com.bit.unchained.gate;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 一次门控调用对应的工作单元
 * 内部状态修改登记撤销动作（undo日志）；对外部托管方的调用延迟到操作末尾统一结算
 * 结算顺序：转入(PULL) -> 预言机同步(SYNC) -> 转出(PAYOUT)
 */
@Slf4j
public class UnitOfWork {

    public enum Phase {
        PULL,
        SYNC,
        PAYOUT
    }

    private static final class Settlement {
        private final Phase phase;
        private final String description;
        private final Runnable action;
        // 结算失败时用于冲正的动作，可为空
        private final Runnable compensation;

        private Settlement(Phase phase, String description, Runnable action, Runnable compensation) {
            this.phase = phase;
            this.description = description;
            this.action = action;
            this.compensation = compensation;
        }
    }

    private final long id;
    private final String operation;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<Settlement> settlements = new ArrayList<>();
    // 单元内的临时状态，单元结束即丢弃
    private final Map<Object, Object> attachments = new HashMap<>();
    // 提交后执行的通知，回滚时丢弃
    private final List<Runnable> commitHooks = new ArrayList<>();
    private boolean settling;

    UnitOfWork(long id, String operation) {
        this.id = id;
        this.operation = operation;
    }

    public long getId() {
        return id;
    }

    public String getOperation() {
        return operation;
    }

    @SuppressWarnings("unchecked")
    public <T> T attachment(Object key, Supplier<T> initializer) {
        return (T) attachments.computeIfAbsent(key, k -> initializer.get());
    }

    /**
     * 登记一条撤销动作，回滚时按登记的逆序执行
     */
    public void onRollback(Runnable undo) {
        undoLog.push(undo);
    }

    /**
     * 登记一笔延迟结算的外部调用
     */
    public void defer(Phase phase, String description, Runnable action, Runnable compensation) {
        if (settling) {
            throw new IllegalStateException("结算阶段不能再登记外部调用: " + description);
        }
        settlements.add(new Settlement(phase, description, action, compensation));
    }

    public void defer(Phase phase, String description, Runnable action) {
        defer(phase, description, action, null);
    }

    /**
     * 登记提交后的通知，在门控释放后按登记顺序执行
     */
    public void onCommit(Runnable hook) {
        commitHooks.add(hook);
    }

    int pendingSettlements() {
        return settlements.size();
    }

    /**
     * 按阶段执行全部外部调用（同阶段保持登记顺序）
     * 任意一笔失败：已完成的调用逆序冲正，然后抛出原异常
     */
    void settle() {
        settling = true;
        List<Settlement> ordered = new ArrayList<>(settlements);
        ordered.sort(Comparator.comparing(s -> s.phase));
        Deque<Settlement> done = new ArrayDeque<>();
        for (Settlement settlement : ordered) {
            try {
                settlement.action.run();
                done.push(settlement);
            } catch (RuntimeException e) {
                log.warn("工作单元[{}:{}]结算失败：{}，开始冲正{}笔已完成调用",
                        id, operation, settlement.description, done.size());
                compensate(done, e);
                throw e;
            }
        }
        log.debug("工作单元[{}:{}]结算完成，外部调用数: {}", id, operation, ordered.size());
    }

    private void compensate(Deque<Settlement> done, RuntimeException cause) {
        while (!done.isEmpty()) {
            Settlement settlement = done.pop();
            if (settlement.compensation == null) {
                log.error("工作单元[{}:{}]无法冲正已完成的外部调用：{}", id, operation, settlement.description);
                continue;
            }
            try {
                settlement.compensation.run();
            } catch (RuntimeException e) {
                log.error("工作单元[{}:{}]冲正失败：{}", id, operation, settlement.description, e);
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * 通知抛出的异常直接交给调用方，此时状态已经提交
     */
    void committed() {
        for (Runnable hook : commitHooks) {
            hook.run();
        }
    }

    /**
     * 逆序执行撤销日志，恢复到工作单元开始前的内部状态
     */
    void rollback() {
        int steps = undoLog.size();
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        log.warn("工作单元[{}:{}]已回滚，撤销步骤数: {}", id, operation, steps);
    }
}
