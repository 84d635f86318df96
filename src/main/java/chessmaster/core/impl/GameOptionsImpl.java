package chessmaster.core.impl;

import chessmaster.core.contracts.Game;
import chessmaster.core.contracts.GameOptions;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Implements the GameOptions contract to manage front-end settings.
 */
public class GameOptionsImpl implements GameOptions {

    public static final String AUTOMATED_OPPONENT = "AutomatedOpponent";
    public static final String SHOW_BOARD = "ShowBoard";

    private final PrintStream out;
    private Game game;

    private static final class Option {
        final String type;
        final String defaultValue;
        final Consumer<String> onSet;
        String value;

        Option(String type, String defaultValue, Consumer<String> onSet) {
            this.type = type;
            this.defaultValue = defaultValue;
            this.onSet = onSet;
            this.value = defaultValue;
        }

        void print(PrintStream out, String name) {
            out.println("option name " + name + " type " + type + " default " + defaultValue);
        }
    }

    private final Map<String, Option> options = new LinkedHashMap<>();

    public GameOptionsImpl(PrintStream out) {
        this.out = out;
        initializeOptions();
    }

    private void initializeOptions() {
        options.put(AUTOMATED_OPPONENT, new Option("check", "false",
                value -> { if (game != null) game.setAutomatedOpponent(Boolean.parseBoolean(value)); }));
        options.put(SHOW_BOARD, new Option("check", "true", value -> {}));
    }

    @Override
    public void attachGame(Game g) {
        this.game = g;
        g.setAutomatedOpponent(isEnabled(AUTOMATED_OPPONENT));
    }

    @Override
    public String getOptionValue(String name) {
        Option o = options.get(name);
        return o != null ? o.value : null;
    }

    @Override
    public boolean isEnabled(String name) {
        return Boolean.parseBoolean(getOptionValue(name));
    }

    @Override
    public void setOption(String line) {
        String[] parts = line.split(" value ", 2);
        String namePart = parts[0].replaceFirst("^\\s*setoption\\s+name\\s+", "").trim();
        String valuePart = parts.length > 1 ? parts[1].trim() : "";

        Option option = options.get(namePart);
        if (option == null) {
            throw new IllegalArgumentException("Unknown option: " + namePart);
        }
        if ("check".equals(option.type)) {
            valuePart = valuePart.toLowerCase(Locale.ROOT);
            if (!valuePart.equals("true") && !valuePart.equals("false")) {
                throw new IllegalArgumentException("Option " + namePart + " expects true or false, got '" + valuePart + "'");
            }
        }
        option.value = valuePart;
        option.onSet.accept(valuePart);
    }

    @Override
    public void printOptions() {
        for (Map.Entry<String, Option> entry : options.entrySet()) {
            entry.getValue().print(out, entry.getKey());
        }
    }
}
