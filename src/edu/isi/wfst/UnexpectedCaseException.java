package edu.isi.wfst;
/** for states the code should never reach, like a compose filter moving into a
    filter state it doesn't define. Not meant to be caught. */

public class UnexpectedCaseException extends RuntimeException {
    /**          Constructs a new exception with null as its detail message. */
    public UnexpectedCaseException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public UnexpectedCaseException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public UnexpectedCaseException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public UnexpectedCaseException(Throwable cause) { super(cause); }
}
