package com.github.flashcard.collection;

/**
 * OrderedMap 中的键值对，同时是链表元素承载的值
 * 由 OrderedMap 持有；value 可原地修改而不改变插入顺序
 */
public final class Pair<K, V> {
    private final K key;
    private V value;

    // 代表本键值对的链表元素（链表持有元素，元素的值就是本对象）
    private Element<Pair<K, V>> element;

    Pair(K key, V value) {
        this.key = key;
        this.value = value;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    V setValue(V value) {
        V old = this.value;
        this.value = value;
        return old;
    }

    Element<Pair<K, V>> element() {
        return element;
    }

    void bind(Element<Pair<K, V>> element) {
        this.element = element;
    }

    /**
     * 插入顺序中的下一个键值对；已是最新或已被删除时返回null
     */
    public Pair<K, V> next() {
        return valueOf(element.next());
    }

    /**
     * 插入顺序中的上一个键值对；已是最旧或已被删除时返回null
     */
    public Pair<K, V> prev() {
        return valueOf(element.prev());
    }

    static <K, V> Pair<K, V> valueOf(Element<Pair<K, V>> element) {
        return element == null ? null : element.getValue();
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
