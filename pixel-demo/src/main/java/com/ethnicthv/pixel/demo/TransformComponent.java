package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.core.components.Component;

/**
 * Position, scale and rotation (degrees) of an entity in world space.
 */
public class TransformComponent implements Component {
    public final Vector2 position;
    public final Vector2 scale;
    public double rotation;

    public TransformComponent() {
        this(new Vector2(0, 0), new Vector2(1, 1), 0.0);
    }

    public TransformComponent(Vector2 position) {
        this(position, new Vector2(1, 1), 0.0);
    }

    public TransformComponent(Vector2 position, Vector2 scale, double rotation) {
        this.position = position;
        this.scale = scale;
        this.rotation = rotation;
    }

    @Override
    public String toString() {
        return "Transform(pos=" + position + ", scale=" + scale + ", rot=" + rotation + ")";
    }
}
