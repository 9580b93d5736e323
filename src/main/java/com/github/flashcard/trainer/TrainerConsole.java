package com.github.flashcard.trainer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * 控制台读写，输出和读入的每一行都会记入 ActionLog
 */
public final class TrainerConsole {
    private final BufferedReader in;
    private final PrintStream out;
    private final ActionLog log;

    public TrainerConsole(BufferedReader in, PrintStream out, ActionLog log) {
        this.in = in;
        this.out = out;
        this.log = log;
    }

    public void println(String line) {
        out.println(line);
        log.append(line);
    }

    public void printf(String format, Object... args) {
        println(String.format(format, args));
    }

    /**
     * 读取一行并去掉首尾空白
     * @throws EndOfInputException 输入已结束
     */
    public String readLine() {
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (line == null) {
            throw new EndOfInputException();
        }
        line = line.strip();
        log.append(line);
        return line;
    }

    public ActionLog log() {
        return log;
    }
}
