package com.ideation.memory.kgraph.exception;

public class InvalidGraphRequestException extends RuntimeException {

    public InvalidGraphRequestException(String message) {
        super(message);
    }
}
