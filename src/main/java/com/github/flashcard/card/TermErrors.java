package com.github.flashcard.card;

import java.util.Objects;

/**
 * definition -> (term, errors) 映射中的值，不可变
 * 更新错误数时生成新实例再原地 set，不改变卡片顺序
 */
public final class TermErrors {
    private final String term;
    private final int errors;

    public TermErrors(String term, int errors) {
        if (errors < 0) throw new IllegalArgumentException("errors < 0: " + errors);
        this.term = Objects.requireNonNull(term, "term");
        this.errors = errors;
    }

    public String term() { return term; }
    public int errors() { return errors; }

    public TermErrors withErrors(int errors) {
        return new TermErrors(term, errors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermErrors)) return false;
        TermErrors that = (TermErrors) o;
        return errors == that.errors && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, errors);
    }

    @Override
    public String toString() {
        return String.format("TermErrors{term=%s, errors=%d}", term, errors);
    }
}
