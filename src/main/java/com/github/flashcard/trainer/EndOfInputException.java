package com.github.flashcard.trainer;

/**
 * 标准输入已关闭；主循环按 exit 处理
 */
final class EndOfInputException extends RuntimeException {
    EndOfInputException() {
        super("end of input");
    }
}
