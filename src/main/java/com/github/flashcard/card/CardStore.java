package com.github.flashcard.card;

import com.github.flashcard.collection.OrderedMap;
import com.github.flashcard.collection.Pair;

import java.util.ArrayList;
import java.util.List;

/**
 * 卡片仓库：两个 OrderedMap 同步维护
 * - termToDef: term -> definition
 * - defToTerm: definition -> (term, errors)
 *
 * 两边的键集合始终一一对应；所有更新都是原地 set，不会改变卡片顺序。
 */
public final class CardStore {
    private final OrderedMap<String, String> termToDef = new OrderedMap<>();
    private final OrderedMap<String, TermErrors> defToTerm = new OrderedMap<>();

    public boolean hasTerm(String term) {
        return termToDef.containsKey(term);
    }

    public boolean hasDefinition(String definition) {
        return defToTerm.containsKey(definition);
    }

    /**
     * 新增卡片，term 和 definition 都必须尚未存在
     * @return 任一已存在时返回false，仓库不变
     */
    public boolean add(String term, String definition) {
        if (hasTerm(term) || hasDefinition(definition)) {
            return false;
        }
        termToDef.set(term, definition);
        defToTerm.set(definition, new TermErrors(term, 0));
        return true;
    }

    /**
     * 导入路径：写入或覆盖一张卡片
     * 同 term 的旧卡片原地更新（旧 definition 条目被移除）；
     * 已占用该 definition 的其他卡片会被移除，保证一一对应。
     */
    public void put(String term, String definition, int errors) {
        String oldDefinition = termToDef.get(term);
        if (oldDefinition != null && !oldDefinition.equals(definition)) {
            defToTerm.delete(oldDefinition);
        }

        TermErrors owner = defToTerm.get(definition);
        if (owner != null && !owner.term().equals(term)) {
            termToDef.delete(owner.term());
        }

        termToDef.set(term, definition);
        defToTerm.set(definition, new TermErrors(term, errors));
    }

    /** 删除卡片，同时移除其 definition 条目 */
    public boolean remove(String term) {
        String definition = termToDef.delete(term);
        if (definition == null) {
            return false;
        }
        defToTerm.delete(definition);
        return true;
    }

    public String definitionOf(String term) {
        return termToDef.get(term);
    }

    /** definition 所属的 term，不存在返回null */
    public String termFor(String definition) {
        TermErrors termErrors = defToTerm.get(definition);
        return termErrors == null ? null : termErrors.term();
    }

    public int errorsFor(String term) {
        String definition = termToDef.get(term);
        if (definition == null) {
            return 0;
        }
        TermErrors termErrors = defToTerm.get(definition);
        return termErrors == null ? 0 : termErrors.errors();
    }

    /** 错误数 +1，位置不变 */
    public void recordError(String term) {
        String definition = termToDef.get(term);
        if (definition == null) {
            return;
        }
        TermErrors termErrors = defToTerm.get(definition);
        defToTerm.set(definition, termErrors.withErrors(termErrors.errors() + 1));
    }

    /** 所有错误数清零（遍历中只做原地 set，不改变结构） */
    public void resetStats() {
        for (Pair<String, TermErrors> pair = defToTerm.oldest(); pair != null; pair = pair.next()) {
            defToTerm.set(pair.getKey(), pair.getValue().withErrors(0));
        }
    }

    /**
     * 错误数最多的全部卡片；并列时全部返回，按插入顺序
     */
    public CardStats hardest() {
        int maxErrors = 0;
        List<String> terms = new ArrayList<>();
        for (Pair<String, TermErrors> pair = defToTerm.oldest(); pair != null; pair = pair.next()) {
            TermErrors termErrors = pair.getValue();
            if (termErrors.errors() > maxErrors) {
                maxErrors = termErrors.errors();
                terms.clear();
                terms.add(termErrors.term());
            } else if (termErrors.errors() == maxErrors && maxErrors > 0) {
                terms.add(termErrors.term());
            }
        }
        return new CardStats(terms, maxErrors);
    }

    /** 最早添加的卡片，quiz 循环的起点 */
    public Pair<String, String> oldest() {
        return termToDef.oldest();
    }

    /** 按插入顺序的卡片快照（导出用） */
    public List<CardRecord> cards() {
        List<CardRecord> cards = new ArrayList<>(termToDef.size());
        for (Pair<String, String> pair = termToDef.oldest(); pair != null; pair = pair.next()) {
            TermErrors termErrors = defToTerm.get(pair.getValue());
            int errors = termErrors == null ? 0 : termErrors.errors();
            cards.add(new CardRecord(pair.getKey(), pair.getValue(), errors));
        }
        return cards;
    }

    public int size() {
        return termToDef.size();
    }

    public boolean isEmpty() {
        return termToDef.isEmpty();
    }
}
