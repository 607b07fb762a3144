package com.mg.content_guard.model;

public enum OversizeAction {
    TRUNCATE,
    REJECT
}
