package org.morm.cli.service;

import org.morm.migration.ChangeReview;
import org.morm.migration.PlannedMigration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Prints each planned migration and asks the operator to confirm it.
 */
public class ConsoleChangeReview implements ChangeReview {

    static final String PROMPT = "Is this correct? [Y/n] ";

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean quiet;
    private final boolean assumeYes;

    public ConsoleChangeReview(BufferedReader in, PrintStream out, boolean quiet, boolean assumeYes) {
        this.in = in;
        this.out = out;
        this.quiet = quiet;
        this.assumeYes = assumeYes;
    }

    @Override
    public boolean approve(PlannedMigration planned) {
        if (!quiet) {
            out.println("-- " + planned.model() + " (table " + planned.table() + ")");
            planned.changeSet().getChanges().forEach(c -> out.println("--   " + c.describe()));
            planned.statements().forEach(sql -> out.println(sql + ";"));
        }
        if (assumeYes) {
            return true;
        }
        out.print(PROMPT);
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String a = answer.trim().toLowerCase(Locale.ROOT);
            return a.isEmpty() || a.equals("y") || a.equals("yes");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
