package com.rumbl.service;

public class UserNotFoundException extends RuntimeException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super("No user with id " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
