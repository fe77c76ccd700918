package com.bit.unchained.gate;

/**
 * 带撤销日志的单值容器，用于整体替换的不可变值（全局参数、资金池总量等）
 */
public class JournaledValue<T> {

    private final NonReentrantGate gate;
    private volatile T value;

    public JournaledValue(NonReentrantGate gate, T initial) {
        this.gate = gate;
        this.value = initial;
    }

    public T get() {
        return value;
    }

    public T set(T newValue) {
        UnitOfWork unit = gate.current();
        T previous = value;
        value = newValue;
        unit.onRollback(() -> value = previous);
        return previous;
    }
}
