package com.github.flashcard.trainer;

import com.github.flashcard.collection.ElementList;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 会话日志：控制台上输出和读入的每一行，按发生顺序保存
 * 由 Trainer 显式持有并传给 TrainerConsole，不是全局单例
 */
public final class ActionLog {
    private final ElementList<String> lines = new ElementList<>();

    public void append(String line) {
        lines.pushBack(line);
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        List<String> copy = new ArrayList<>(lines.size());
        for (String line : lines) {
            copy.add(line);
        }
        return copy;
    }

    /** 写出全部日志行，覆盖已有文件 */
    public void saveTo(Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.newLine();
            }
        }
    }
}
