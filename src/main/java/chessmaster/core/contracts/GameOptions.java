package chessmaster.core.contracts;

/**
 * Named, settable front-end options in the style of UCI {@code setoption}.
 */
public interface GameOptions {

    /**
     * Parses a "setoption name &lt;N&gt; value &lt;V&gt;" line and applies it.
     *
     * @throws IllegalArgumentException on an unknown option or an unusable value
     */
    void setOption(String line);

    /** Prints one "option name … type … default …" line per option. */
    void printOptions();

    String getOptionValue(String name);

    boolean isEnabled(String name);

    void attachGame(Game game);
}
