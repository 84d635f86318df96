package chessmaster.core.contracts;

/**
 * Line-oriented text front end. An implementation reads commands from an input stream,
 * applies them to a {@link Game} and writes the replies.
 */
public interface ConsoleHandler {

    /**
     * Processes commands until "quit" is received or the input stream is closed.
     */
    void runLoop();
}
