package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.entity.Entity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Demo showing the coordinator driving a physics system for a few fixed steps.
 * <p>
 * Each step follows the frame contract: {@code update()} first to commit last step's structural
 * changes, then the systems.
 */
public class CoordinatorDemo {
    private static final Logger LOG = LogManager.getLogger(CoordinatorDemo.class);

    private static final float FPS = 60.0f;

    public static void main(String[] args) {
        int steps = args.length > 0 ? Integer.parseInt(args[0]) : 5;

        try (Coordinator coordinator = Coordinator.builder()
                .registerComponent(TransformComponent.class)
                .registerComponent(RigidBodyComponent.class)
                .addSystem(new PhysicsSystem())
                .build()) {

            Entity player = coordinator.create();
            coordinator.addComponent(player, new TransformComponent(new Vector2(10, 30), new Vector2(1, 1), 0.0));
            coordinator.addComponent(player, new RigidBodyComponent(new Vector2(50, 0)));
            coordinator.tagEntity(player, "player");

            Entity crate = coordinator.create();
            coordinator.addComponent(crate, new TransformComponent(new Vector2(200, 30)));
            coordinator.groupEntity(crate, "props");

            for (int step = 0; step < steps; step++) {
                coordinator.update();
                coordinator.updateSystems(1.0f / FPS);
            }

            TransformComponent transform = coordinator.getComponent(player, TransformComponent.class);
            LOG.info("After {} steps the player is at {}", steps, transform.position);
            LOG.info("Props: {}", coordinator.getEntitiesByGroup("props"));

            coordinator.destroy(crate);
            coordinator.update();
            LOG.info("Live entities after destroying the crate: {}", coordinator.getEntityCount());
        }
    }
}
