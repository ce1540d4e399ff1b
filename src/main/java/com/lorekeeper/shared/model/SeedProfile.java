package com.lorekeeper.shared.model;

/** Static profile fields that become seed memories. */
public record SeedProfile(String name, String persona, String firstMessage) {}
