package com.bit.unchained.gate;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 带撤销日志的映射：写操作必须在门控内执行并登记撤销动作，读操作无锁
 */
public class JournaledMap<K, V> {

    private final NonReentrantGate gate;
    private final ConcurrentHashMap<K, V> entries = new ConcurrentHashMap<>();

    public JournaledMap(NonReentrantGate gate) {
        this.gate = gate;
    }

    public V get(K key) {
        return entries.get(key);
    }

    public V getOrDefault(K key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public ImmutableMap<K, V> snapshot() {
        return ImmutableMap.copyOf(entries);
    }

    public V put(K key, V value) {
        UnitOfWork unit = gate.current();
        V previous = entries.put(key, value);
        unit.onRollback(() -> restore(key, previous));
        return previous;
    }

    public V remove(K key) {
        UnitOfWork unit = gate.current();
        V previous = entries.remove(key);
        if (previous != null) {
            unit.onRollback(() -> entries.put(key, previous));
        }
        return previous;
    }

    private void restore(K key, V previous) {
        if (previous == null) {
            entries.remove(key);
        } else {
            entries.put(key, previous);
        }
    }
}
