package com.earningsbot.model;

public enum AlertType {
    ENTRY,
    EXIT
}
