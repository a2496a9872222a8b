package org.broadinstitute.varpos.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as malformed position strings.
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
     * Class UserException.InvalidPositionSyntax
     * <p/>
     * For strings that do not match any shape of the variant position grammar
     */
    public static class InvalidPositionSyntax extends UserException {
        private static final long serialVersionUID = 0L;

        private final String positionString;

        public InvalidPositionSyntax(final String positionString) {
            super(String.format("invalid variant position string '%s'", positionString));
            this.positionString = positionString;
        }

        public InvalidPositionSyntax(final String positionString, final Throwable cause) {
            super(String.format("invalid variant position string '%s': %s", positionString, getMessage(cause)), cause);
            this.positionString = positionString;
        }

        /**
         * @return the string that failed to parse, possibly {@code null}
         */
        public String getPositionString() {
            return positionString;
        }
    }
}
