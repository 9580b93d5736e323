package com.github.flashcard.collection;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 带哨兵的环形双向链表
 *
 * 哨兵元素不存数据，它的 next 是头部、prev 是尾部；空链表时哨兵指向自己。
 * size 始终等于从哨兵出发沿 next 能走到的非哨兵元素个数。
 * 非线程安全，仅供单线程使用。
 */
public final class ElementList<T> implements Iterable<T> {
    private final Element<T> root; // 哨兵节点
    private int size;

    public ElementList() {
        this.root = new Element<>(null);
        clear();
    }

    /**
     * 重置为空环：哨兵前后都指向自己
     * 仍挂在链表上的元素会被摘除（next()/prev() 返回null）
     */
    public void clear() {
        Element<T> e = root.getNext();
        while (e != null && e != root) {
            Element<T> following = e.getNext();
            detach(e);
            e = following;
        }
        root.setPrevious(root);
        root.setNext(root);
        size = 0;
    }

    /** 添加到尾部 - O(1)，不会失败 */
    public Element<T> pushBack(T value) {
        return insertAfter(new Element<>(value), root.getPrevious());
    }

    private Element<T> insertAfter(Element<T> e, Element<T> at) {
        Element<T> next = at.getNext();
        e.setPrevious(at);
        e.setNext(next);
        at.setNext(e);
        next.setPrevious(e);
        e.setOwner(this);
        size++;
        return e;
    }

    /**
     * 摘除指定元素 - O(1)
     *
     * @return 元素不属于本链表（或已被摘除）时返回false，链表保持不变
     */
    public boolean remove(Element<T> e) {
        if (e == null || e == root || e.owner() != this) {
            return false;
        }
        Element<T> prev = e.getPrevious();
        Element<T> next = e.getNext();
        prev.setNext(next);
        next.setPrevious(prev);
        detach(e);
        size--;
        return true;
    }

    private static <T> void detach(Element<T> e) {
        // 清理引用帮助GC
        e.setPrevious(null);
        e.setNext(null);
        e.setOwner(null);
    }

    /** 头部元素，空链表返回null */
    public Element<T> front() {
        return size == 0 ? null : root.getNext();
    }

    /** 尾部元素，空链表返回null */
    public Element<T> back() {
        return size == 0 ? null : root.getPrevious();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    Element<T> sentinel() {
        return root;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private Element<T> cursor = front();

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public T next() {
                if (cursor == null) {
                    throw new NoSuchElementException();
                }
                T value = cursor.getValue();
                cursor = cursor.next();
                return value;
            }
        };
    }
}
