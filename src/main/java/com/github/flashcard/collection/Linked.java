package com.github.flashcard.collection;

/**
 * 双向链接接口 - 解耦链表操作与具体元素类型
 * ElementList 只通过这四个方法维护前后指针
 */
public interface Linked<E> {
    E getPrevious();
    void setPrevious(E prev);
    E getNext();
    void setNext(E next);
}
