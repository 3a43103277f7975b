package edu.isi.wfst;
/** for composing transducers whose linking alphabets (output of the first,
    input of the second) are not the same symbol table */
public class SymbolTableMismatchException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public SymbolTableMismatchException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public SymbolTableMismatchException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public SymbolTableMismatchException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public SymbolTableMismatchException(Throwable cause) { super(cause); }
}
