package com.github.flashcard.collection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 保持插入顺序的映射：HashMap 负责 O(1) 查找，ElementList 负责顺序
 *
 * 不变式：
 * 1. pairs 的键集合 == 沿链表遍历得到的键集合
 * 2. 每个 pairs 条目对应且仅对应一个链表元素
 * 3. 更新已有键不改变其位置；删除后重新插入的键追加到尾部
 *
 * 键和值均不允许为null，因此返回null即表示"不存在"。
 * 非线程安全。
 */
public final class OrderedMap<K, V> implements Iterable<Pair<K, V>> {
    private final HashMap<K, Pair<K, V>> pairs;
    private final ElementList<Pair<K, V>> list;

    public OrderedMap() {
        this(16);
    }

    public OrderedMap(int initialCapacity) {
        if (initialCapacity < 0) throw new IllegalArgumentException();
        this.pairs = new HashMap<>(initialCapacity);
        this.list = new ElementList<>();
    }

    /** O(1) 查找，不影响顺序；不存在返回null */
    public V get(K key) {
        Pair<K, V> pair = pairs.get(key);
        return pair == null ? null : pair.getValue();
    }

    public Pair<K, V> getPair(K key) {
        return pairs.get(key);
    }

    public boolean containsKey(K key) {
        return pairs.containsKey(key);
    }

    /**
     * 写入键值对
     * 已存在：原地替换值，位置不变，返回旧值
     * 不存在：追加到链表尾部并登记到哈希表，返回null
     */
    public V set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        Pair<K, V> pair = pairs.get(key);
        if (pair != null) {
            return pair.setValue(value);
        }

        pair = new Pair<>(key, value);
        pair.bind(list.pushBack(pair));
        pairs.put(key, pair);
        return null;
    }

    /**
     * 删除键值对 - O(1)
     * 先从链表摘除再移除哈希条目；键不存在时无副作用并返回null
     */
    public V delete(K key) {
        Pair<K, V> pair = pairs.get(key);
        if (pair == null) {
            return null;
        }
        list.remove(pair.element());
        pairs.remove(key);
        return pair.getValue();
    }

    /** 最早插入的键值对（链表头部），空映射返回null */
    public Pair<K, V> oldest() {
        return Pair.valueOf(list.front());
    }

    /** 最新插入的键值对（链表尾部），空映射返回null */
    public Pair<K, V> newest() {
        return Pair.valueOf(list.back());
    }

    /** 等价于 pair.next() */
    public Pair<K, V> next(Pair<K, V> pair) {
        return pair.next();
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /** 按插入顺序的键快照 */
    public List<K> keys() {
        List<K> keys = new ArrayList<>(pairs.size());
        for (Pair<K, V> pair = oldest(); pair != null; pair = pair.next()) {
            keys.add(pair.getKey());
        }
        return keys;
    }

    @Override
    public Iterator<Pair<K, V>> iterator() {
        return list.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Pair<K, V> pair = oldest(); pair != null; pair = pair.next()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(pair);
        }
        return sb.append('}').toString();
    }
}
