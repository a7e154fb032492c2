package com.trading.calcgraph.api;

/**
 * Base class of every error raised by the engine itself.
 *
 * Errors thrown by user calculation bodies are never wrapped in this type; they
 * reach the caller unchanged.
 */
public class CalcGraphException extends RuntimeException {

    public CalcGraphException(String message) {
        super(message);
    }
}
