package com.sketchsync.service;

public enum ChangeOrigin {
    LOCAL,
    REMOTE,
    RESET,
    LOADED
}
