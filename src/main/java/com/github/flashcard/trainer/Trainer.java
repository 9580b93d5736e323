package com.github.flashcard.trainer;

import com.github.flashcard.card.AnswerResult;
import com.github.flashcard.card.CardFileException;
import com.github.flashcard.card.CardFiles;
import com.github.flashcard.card.CardStore;
import com.github.flashcard.card.Quiz;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 交互主循环：读取动作并分发，直到 exit 或输入结束
 */
public final class Trainer {
    private static final Logger log = LoggerFactory.getLogger(Trainer.class);

    private final CardStore store;
    private final CardFiles files;
    private final TrainerConsole console;
    private final TrainerOptions options;

    public Trainer(CardStore store, CardFiles files, TrainerConsole console, TrainerOptions options) {
        this.store = store;
        this.files = files;
        this.console = console;
        this.options = options;
    }

    public void run() {
        if (options.importFrom() != null) {
            importCards(options.importFrom());
        }

        try {
            Action action;
            do {
                console.println(Action.MENU);
                String command = console.readLine();
                action = Action.fromCommand(command);
                if (action == null) {
                    log.debug("Ignoring unknown action: {}", command);
                } else {
                    dispatch(action);
                }
                if (action != Action.EXIT) {
                    console.println("");
                }
            } while (action != Action.EXIT);
        } catch (EndOfInputException e) {
            log.debug("Input closed, exiting");
            exit();
        }
    }

    private void dispatch(Action action) {
        switch (action) {
            case ADD -> add();
            case REMOVE -> remove();
            case IMPORT -> importCards(readPath());
            case EXPORT -> exportCards(readPath());
            case ASK -> ask();
            case EXIT -> exit();
            case LOG -> saveLog();
            case HARDEST_CARD -> console.println(store.hardest().describe());
            case RESET_STATS -> {
                store.resetStats();
                console.println("Card statistics have been reset.");
            }
        }
    }

    private void add() {
        console.println("The card:");
        String term = console.readLine();
        while (store.hasTerm(term)) {
            console.printf("The card \"%s\" already exists. Try again:", term);
            term = console.readLine();
        }

        console.println("The definition of the card:");
        String definition = console.readLine();
        while (store.hasDefinition(definition)) {
            console.printf("The definition \"%s\" already exists. Try again:", definition);
            definition = console.readLine();
        }

        store.add(term, definition);
        console.printf("The pair (\"%s\":\"%s\") has been added.", term, definition);
    }

    private void remove() {
        console.println("Which card?");
        String term = console.readLine();
        if (store.remove(term)) {
            console.println("The card has been removed.");
        } else {
            console.printf("Can't remove \"%s\": there is no such card.", term);
        }
    }

    private Path readPath() {
        console.println("File name:");
        String name = console.readLine();
        try {
            return Paths.get(name);
        } catch (InvalidPathException e) {
            log.warn("Invalid file name: {}", name);
            return null;
        }
    }

    private void importCards(Path file) {
        if (file == null) {
            console.println("File not found.");
            return;
        }
        try {
            int loaded = files.importFrom(file, store);
            console.printf("%d cards have been loaded.", loaded);
        } catch (NoSuchFileException e) {
            console.println("File not found.");
        } catch (CardFileException e) {
            log.error("Import from {} failed", file, e);
            console.printf("Can't read cards from \"%s\".", file);
        }
    }

    private void exportCards(Path file) {
        if (file == null) {
            console.println("File not found.");
            return;
        }
        try {
            int saved = files.exportTo(file, store);
            console.printf("%d cards have been saved.", saved);
        } catch (CardFileException e) {
            log.error("Export to {} failed", file, e);
            console.printf("Can't save cards to \"%s\".", file);
        }
    }

    private void ask() {
        console.println("How many times to ask?");
        String input = console.readLine();
        int asks;
        try {
            asks = Integer.parseInt(input);
        } catch (NumberFormatException e) {
            console.printf("\"%s\" is not a number.", input);
            return;
        }

        Quiz quiz = new Quiz(store);
        for (int i = 0; i < asks; i++) {
            String term = quiz.nextTerm();
            if (term == null) {
                break;
            }
            console.printf("Print the definition of \"%s\":", term);
            AnswerResult result = quiz.answer(term, console.readLine());
            console.println(result.describe());
        }
    }

    private void saveLog() {
        Path file = readPath();
        if (file == null) {
            console.println("File not found.");
            return;
        }
        try {
            console.log().saveTo(file);
        } catch (IOException e) {
            log.error("Saving log to {} failed", file, e);
            console.printf("Can't save the log to \"%s\".", file);
            return;
        }
        console.println("The log has been saved.");
    }

    private void exit() {
        console.println("Bye bye!");
        if (options.exportTo() != null) {
            exportCards(options.exportTo());
        }
    }
}
