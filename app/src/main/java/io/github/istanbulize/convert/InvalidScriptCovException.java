package io.github.istanbulize.convert;

/** A script coverage snapshot violates V8's format guarantees. */
public class InvalidScriptCovException extends RuntimeException {

    public InvalidScriptCovException(String message) {
        super("InvalidScriptCov: " + message);
    }
}
