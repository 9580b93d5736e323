package com.github.flashcard.trainer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 启动参数：
 * --import_from FILE（或 -import FILE）启动时导入
 * --export_to FILE（或 -export FILE）退出时导出
 */
public final class TrainerOptions {
    private static final String USAGE = "Usage: flashcards [--import_from FILE] [--export_to FILE]";

    private final Path importFrom;
    private final Path exportTo;

    private TrainerOptions(Builder builder) {
        this.importFrom = builder.importFrom;
        this.exportTo = builder.exportTo;
    }

    public static String usage() {
        return USAGE;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * 解析命令行参数
     * @throws IllegalArgumentException 未知参数或缺少参数值
     */
    public static TrainerOptions parse(String... args) {
        Builder builder = newBuilder();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--import_from", "-import" -> builder.importFrom(Paths.get(valueOf(args, ++i, flag)));
                case "--export_to", "-export" -> builder.exportTo(Paths.get(valueOf(args, ++i, flag)));
                default -> throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }
        return builder.build();
    }

    private static String valueOf(String[] args, int index, String flag) {
        if (index >= args.length || args[index].isBlank()) {
            throw new IllegalArgumentException("Missing file name after " + flag);
        }
        return args[index];
    }

    /** 启动时导入的文件，未配置返回null */
    public Path importFrom() { return importFrom; }

    /** 退出时导出的文件，未配置返回null */
    public Path exportTo() { return exportTo; }

    @Override
    public String toString() {
        return "TrainerOptions{importFrom=" + importFrom + ", exportTo=" + exportTo + '}';
    }

    public static final class Builder {
        private Path importFrom;
        private Path exportTo;

        private Builder() {}

        public Builder importFrom(Path file) {
            this.importFrom = file;
            return this;
        }

        public Builder exportTo(Path file) {
            this.exportTo = file;
            return this;
        }

        public TrainerOptions build() {
            return new TrainerOptions(this);
        }
    }
}
