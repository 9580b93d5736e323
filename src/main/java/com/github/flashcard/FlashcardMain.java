package com.github.flashcard;

import com.github.flashcard.card.CardFiles;
import com.github.flashcard.card.CardStore;
import com.github.flashcard.trainer.ActionLog;
import com.github.flashcard.trainer.Trainer;
import com.github.flashcard.trainer.TrainerConsole;
import com.github.flashcard.trainer.TrainerOptions;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public final class FlashcardMain {
    private FlashcardMain() {}

    public static void main(String[] args) {
        TrainerOptions options;
        try {
            options = TrainerOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(TrainerOptions.usage());
            System.exit(2);
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        TrainerConsole console = new TrainerConsole(in, System.out, new ActionLog());
        new Trainer(new CardStore(), new CardFiles(), console, options).run();
    }
}
