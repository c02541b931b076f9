package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.core.components.Component;

public class RigidBodyComponent implements Component {
    public final Vector2 velocity;
    public final Vector2 acceleration;
    public double mass;

    public RigidBodyComponent() {
        this(new Vector2(0, 0), new Vector2(0, 0), 0.0);
    }

    public RigidBodyComponent(Vector2 velocity) {
        this(velocity, new Vector2(0, 0), 0.0);
    }

    public RigidBodyComponent(Vector2 velocity, Vector2 acceleration, double mass) {
        this.velocity = velocity;
        this.acceleration = acceleration;
        this.mass = mass;
    }

    @Override
    public String toString() {
        return "RigidBody(vel=" + velocity + ", acc=" + acceleration + ", mass=" + mass + ")";
    }
}
