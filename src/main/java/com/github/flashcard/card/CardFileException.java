package com.github.flashcard.card;

/**
 * 卡片文件读写失败（I/O 或编码错误）
 */
public class CardFileException extends RuntimeException {
    public CardFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
