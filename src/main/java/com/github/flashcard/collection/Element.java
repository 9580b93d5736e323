package com.github.flashcard.collection;

/**
 * 侵入式链表元素：链接指针直接存放在元素内部
 *
 * list 字段只用于校验归属（remove 时）和判断是否到达尾部，
 * 不代表所有权：元素由所属的 ElementList 持有。
 */
public final class Element<T> implements Linked<Element<T>> {
    private Element<T> prev;
    private Element<T> next;

    // 所属链表，摘除后置为null
    private ElementList<T> list;

    private final T value;

    Element(T value) {
        this.value = value;
    }

    public T getValue() {
        return value;
    }

    /**
     * 后继元素；当前为尾部或已被摘除时返回null
     */
    public Element<T> next() {
        Element<T> n = next;
        if (list != null && n != list.sentinel()) {
            return n;
        }
        return null;
    }

    /**
     * 前驱元素；当前为头部或已被摘除时返回null
     */
    public Element<T> prev() {
        Element<T> p = prev;
        if (list != null && p != list.sentinel()) {
            return p;
        }
        return null;
    }

    /** 是否仍挂在某个链表上 */
    public boolean isAttached() {
        return list != null;
    }

    ElementList<T> owner() { return list; }
    void setOwner(ElementList<T> list) { this.list = list; }

    @Override public Element<T> getPrevious() { return prev; }
    @Override public void setPrevious(Element<T> prev) { this.prev = prev; }

    @Override public Element<T> getNext() { return next; }
    @Override public void setNext(Element<T> next) { this.next = next; }

    @Override
    public String toString() {
        return "Element{" + value + '}';
    }
}
