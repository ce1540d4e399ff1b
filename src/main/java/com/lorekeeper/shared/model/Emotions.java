package com.lorekeeper.shared.model;

public record Emotions(double positive, double negative, double neutral) {

    public static final Emotions NONE = new Emotions(0.0, 0.0, 0.0);

    public double intensity() {
        return Math.max(positive, negative);
    }
}
