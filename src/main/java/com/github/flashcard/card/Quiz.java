package com.github.flashcard.card;

import com.github.flashcard.collection.Pair;

/**
 * 循环出题：从最早的卡片开始按插入顺序提问，越过最新一张后回到最早一张
 *
 * 每次 ask 动作新建一个 Quiz；出题期间不应增删卡片。
 */
public final class Quiz {
    private final CardStore store;
    private Pair<String, String> cursor;

    public Quiz(CardStore store) {
        this.store = store;
    }

    /**
     * 下一道题的 term；仓库为空时返回null
     */
    public String nextTerm() {
        cursor = cursor == null ? store.oldest() : cursor.next();
        if (cursor == null) {
            cursor = store.oldest();
        }
        return cursor == null ? null : cursor.getKey();
    }

    /**
     * 判定答案；答错时该卡片错误数 +1
     */
    public AnswerResult answer(String term, String userDefinition) {
        String expected = store.definitionOf(term);
        if (expected == null) {
            throw new IllegalArgumentException("No such card: " + term);
        }
        if (expected.equals(userDefinition)) {
            return AnswerResult.correct(expected);
        }
        store.recordError(term);
        return AnswerResult.wrong(expected, store.termFor(userDefinition));
    }
}
