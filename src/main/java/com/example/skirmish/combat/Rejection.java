package com.example.skirmish.combat;

public record Rejection(RejectionCode code, String message) {
    
    public Rejection {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        message = message != null ? message : code.name();
    }
}
