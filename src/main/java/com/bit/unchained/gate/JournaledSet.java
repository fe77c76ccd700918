package com.bit.unchained.gate;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 带撤销日志的只增集合
 */
public class JournaledSet<E> {

    private final NonReentrantGate gate;
    private final Set<E> elements = ConcurrentHashMap.newKeySet();

    public JournaledSet(NonReentrantGate gate) {
        this.gate = gate;
    }

    public boolean contains(E element) {
        return elements.contains(element);
    }

    public int size() {
        return elements.size();
    }

    /**
     * @return 元素此前不存在时返回true
     */
    public boolean add(E element) {
        UnitOfWork unit = gate.current();
        boolean added = elements.add(element);
        if (added) {
            unit.onRollback(() -> elements.remove(element));
        }
        return added;
    }
}
