package com.lorekeeper.memory;

public enum SearchPath {
    ACCELERATED,
    BRUTE_FORCE
}
