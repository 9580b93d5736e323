package com.github.flashcard.trainer;

/**
 * 主循环支持的动作，command 为用户输入的原文
 */
public enum Action {
    ADD("add"),
    REMOVE("remove"),
    IMPORT("import"),
    EXPORT("export"),
    ASK("ask"),
    EXIT("exit"),
    LOG("log"),
    HARDEST_CARD("hardest card"),
    RESET_STATS("reset stats");

    static final String MENU =
            "Input the action (add, remove, import, export, ask, exit, log, hardest card, reset stats):";

    private final String command;

    Action(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    /**
     * @return 对应的动作；无法识别时返回null
     */
    public static Action fromCommand(String command) {
        for (Action action : values()) {
            if (action.command.equals(command)) {
                return action;
            }
        }
        return null;
    }
}
