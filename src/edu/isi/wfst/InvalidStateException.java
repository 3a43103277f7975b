package edu.isi.wfst;
/** for state ids that don't name a state of the transducer they're used on */

public class InvalidStateException extends RuntimeException {
    /**          Constructs a new exception with null as its detail message. */
    public InvalidStateException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public InvalidStateException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public InvalidStateException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public InvalidStateException(Throwable cause) { super(cause); }
}
