package com.mg.content_guard.model;

public enum ThreatCategory {
    PATH_TRAVERSAL,
    MARKUP_INJECTION,
    SQL_INJECTION,
    SCRIPT_URI
}
