package com.github.flashcard.card;

import java.util.List;

/**
 * "最难卡片"统计快照：错误数最多的所有卡片（按插入顺序）
 */
public final class CardStats {
    private final List<String> hardestTerms;
    private final int maxErrors;

    public CardStats(List<String> hardestTerms, int maxErrors) {
        this.hardestTerms = List.copyOf(hardestTerms);
        this.maxErrors = maxErrors;
    }

    public List<String> hardestTerms() { return hardestTerms; }
    public int maxErrors() { return maxErrors; }

    public boolean hasErrors() {
        return maxErrors > 0 && !hardestTerms.isEmpty();
    }

    /** 控制台展示文本 */
    public String describe() {
        if (!hasErrors()) {
            return "There are no cards with errors.";
        }
        if (hardestTerms.size() == 1) {
            return String.format("The hardest card is \"%s\". You have %d errors answering it.",
                    hardestTerms.get(0), maxErrors);
        }
        StringBuilder terms = new StringBuilder();
        for (String term : hardestTerms) {
            if (terms.length() > 0) terms.append(", ");
            terms.append('"').append(term).append('"');
        }
        return String.format("The hardest cards are %s. You have %d errors answering them.",
                terms, maxErrors);
    }

    @Override
    public String toString() {
        return String.format("CardStats{hardest=%s, maxErrors=%d}", hardestTerms, maxErrors);
    }
}
