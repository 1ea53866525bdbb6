package com.example.FundScout.model;

public enum TurnType {
    NEW_QUERY,
    FOLLOW_UP,
    NO_MATCHES
}
