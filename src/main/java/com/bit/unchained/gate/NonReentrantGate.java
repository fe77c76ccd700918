package com.bit.unchained.gate;

import com.bit.unchained.error.StakingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 全局非重入门控：引擎所有修改状态的入口串行执行
 * 同一线程在持有门控期间再次进入（例如NFT回调中回调引擎）直接拒绝
 * 每次进入开启一个工作单元，异常时整体回滚
 */
@Slf4j
@Component
public class NonReentrantGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong unitIdGenerator = new AtomicLong(0);
    // 只在持锁线程内读写
    private UnitOfWork current;

    public <T> T execute(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("拒绝重入调用：{}（当前工作单元: {}）", operation, current.getOperation());
            throw StakingException.forbidden("重入调用被拒绝: " + operation);
        }
        lock.lock();
        UnitOfWork unit = new UnitOfWork(unitIdGenerator.incrementAndGet(), operation);
        current = unit;
        T result;
        try {
            result = body.get();
            unit.settle();
        } catch (RuntimeException e) {
            unit.rollback();
            throw e;
        } finally {
            current = null;
            lock.unlock();
        }
        // 通知在门控释放后发出，监听方可以再次调用引擎
        unit.committed();
        return result;
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * 当前线程所在的工作单元，不在门控内调用属于编程错误
     */
    public UnitOfWork current() {
        if (!lock.isHeldByCurrentThread() || current == null) {
            throw new IllegalStateException("状态修改必须在门控内执行");
        }
        return current;
    }

    public boolean isEntered() {
        return lock.isHeldByCurrentThread();
    }
}
