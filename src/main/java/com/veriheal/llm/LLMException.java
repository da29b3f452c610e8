package com.veriheal.llm;

public class LLMException extends RuntimeException {

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
