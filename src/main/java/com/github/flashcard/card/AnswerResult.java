package com.github.flashcard.card;

/**
 * 一次作答的判定结果
 */
public final class AnswerResult {
    public enum Verdict {
        CORRECT,
        WRONG,
        // 答案是另一张卡片的 definition
        WRONG_OTHER_TERM
    }

    private final Verdict verdict;
    private final String expected;
    private final String otherTerm;

    private AnswerResult(Verdict verdict, String expected, String otherTerm) {
        this.verdict = verdict;
        this.expected = expected;
        this.otherTerm = otherTerm;
    }

    static AnswerResult correct(String expected) {
        return new AnswerResult(Verdict.CORRECT, expected, null);
    }

    static AnswerResult wrong(String expected, String otherTerm) {
        return otherTerm == null
                ? new AnswerResult(Verdict.WRONG, expected, null)
                : new AnswerResult(Verdict.WRONG_OTHER_TERM, expected, otherTerm);
    }

    public Verdict verdict() { return verdict; }
    public String expected() { return expected; }
    public String otherTerm() { return otherTerm; }

    public boolean isCorrect() {
        return verdict == Verdict.CORRECT;
    }

    public String describe() {
        return switch (verdict) {
            case CORRECT -> "Correct!";
            case WRONG -> String.format("Wrong. The right answer is \"%s\".", expected);
            case WRONG_OTHER_TERM -> String.format(
                    "Wrong. The right answer is \"%s\", but your definition is correct for \"%s\".",
                    expected, otherTerm);
        };
    }

    @Override
    public String toString() {
        return "AnswerResult{" + verdict + ", expected=" + expected + ", otherTerm=" + otherTerm + '}';
    }
}
