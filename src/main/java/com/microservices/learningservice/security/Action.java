package com.microservices.learningservice.security;

public enum Action {
    READ,
    CREATE,
    UPDATE,
    DELETE;

    public boolean isWrite() {
        return this != READ;
    }
}
