package edu.isi.wfst;
/** for lookups of a label or id that a symbol table doesn't hold */

public class SymbolNotFoundException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public SymbolNotFoundException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public SymbolNotFoundException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public SymbolNotFoundException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public SymbolNotFoundException(Throwable cause) { super(cause); }
}
