package io.tasklink.persist;

/**
 * A read or write was asked of a manager that has no backing file.
 */
public class NoFileException extends PersistenceException {
    public NoFileException() {
        super("no file configured");
    }
}
