package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.core.entity.Entity;
import com.ethnicthv.pixel.core.system.BaseSystem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves every entity with a transform and a rigid body by its velocity.
 * <p>
 * Gravity is stored for callers that want it but is not applied yet; integration is plain
 * {@code position += velocity * dt}.
 */
public class PhysicsSystem extends BaseSystem {
    private static final Logger LOG = LogManager.getLogger(PhysicsSystem.class);

    public static final double DEFAULT_GRAVITY = 9.81;

    private final double gravity;

    public PhysicsSystem() {
        this(DEFAULT_GRAVITY);
    }

    public PhysicsSystem(double gravity) {
        this.gravity = gravity;
        requireComponent(TransformComponent.class);
        requireComponent(RigidBodyComponent.class);
    }

    public double getGravity() {
        return gravity;
    }

    @Override
    public void onUpdate(float deltaTime) {
        for (Entity entity : getSystemEntities()) {
            TransformComponent transform = coordinator.getComponent(entity, TransformComponent.class);
            RigidBodyComponent body = coordinator.getComponent(entity, RigidBodyComponent.class);

            transform.position.addScaled(body.velocity, deltaTime);

            LOG.trace("{} moved to {}", entity, transform.position);
        }
    }
}
