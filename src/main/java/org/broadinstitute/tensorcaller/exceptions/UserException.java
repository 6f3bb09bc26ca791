package org.broadinstitute.tensorcaller.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final String source, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", source, message));
        }

        public CouldNotReadInputFile(final String source, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", source, message), cause);
        }

        public CouldNotReadInputFile(final Path file, final Exception e) {
            this(file.toAbsolutePath().toUri().toString(), getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final String filename, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            this(file.toAbsolutePath().toUri().toString(), "an error occurred", e);
        }
    }

    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final String message) {
            super("Unknown file is malformed: " + message);
        }

        public MalformedFile(final String source, final String message) {
            super(String.format("File %s is malformed: %s", source, message));
        }

        public MalformedFile(final String source, final String message, final Exception e) {
            super(String.format("File %s is malformed: %s caused by %s", source, message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }

        public BadInput(final String message, final Throwable cause) {
            super("Bad input: " + message, cause);
        }
    }
}
