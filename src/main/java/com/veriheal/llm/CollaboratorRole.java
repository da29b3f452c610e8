package com.veriheal.llm;

public enum CollaboratorRole {
    GENERATOR,
    DIAGNOSER,
    PATCHER
}
