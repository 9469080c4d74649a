package com.chambua.qualifiers.service;

/** A standings row that parsed but carries values no table can produce (negative counters, rank below 1). */
public class InvalidStandingException extends IllegalArgumentException {
    public InvalidStandingException(String message) {
        super(message);
    }
}
