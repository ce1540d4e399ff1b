package com.lorekeeper.core;

public record RecycleProgress(Step step, String message, int current, int total) {

    public enum Step { CLEARING, SEEDING, JOURNALING, COMPLETE, FAILED }
}
