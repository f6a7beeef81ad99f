package com.schemkit.model;

public enum TextStyle {
    BOLD,
    ITALIC,
    OBLIQUE
}
