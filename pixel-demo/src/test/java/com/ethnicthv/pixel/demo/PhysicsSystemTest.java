package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.entity.Entity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PhysicsSystemTest {

    private Coordinator coordinator;
    private PhysicsSystem physics;

    @BeforeEach
    void setUp() {
        coordinator = new Coordinator();
        physics = coordinator.addSystem(new PhysicsSystem());
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Test
    @DisplayName("One reconciliation and one step of dt=1.0 moves (100,100) by (30,0)")
    void singleStepScenario() {
        Entity e = coordinator.create();
        coordinator.addComponent(e, new TransformComponent(new Vector2(100, 100)));
        coordinator.addComponent(e, new RigidBodyComponent(new Vector2(30, 0)));

        coordinator.update();
        coordinator.getSystem(PhysicsSystem.class).onUpdate(1.0f);

        assertEquals(new Vector2(130, 100), coordinator.getComponent(e, TransformComponent.class).position);
    }

    @Test
    void entityIsNotMovedBeforeReconciliation() {
        Entity e = coordinator.create();
        coordinator.addComponent(e, new TransformComponent(new Vector2(0, 0)));
        coordinator.addComponent(e, new RigidBodyComponent(new Vector2(5, 5)));

        physics.onUpdate(1.0f);

        assertEquals(new Vector2(0, 0), coordinator.getComponent(e, TransformComponent.class).position);
    }

    @Test
    void onlyEntitiesWithBothComponentsAreMatched() {
        Entity mover = coordinator.create();
        coordinator.addComponent(mover, new TransformComponent(new Vector2(0, 0)));
        coordinator.addComponent(mover, new RigidBodyComponent(new Vector2(1, 2)));
        Entity prop = coordinator.create();
        coordinator.addComponent(prop, new TransformComponent(new Vector2(7, 7)));
        coordinator.update();

        coordinator.updateSystems(0.5f);

        assertEquals(List.of(mover), physics.getSystemEntities());
        assertEquals(new Vector2(0.5f, 1), coordinator.getComponent(mover, TransformComponent.class).position);
        assertEquals(new Vector2(7, 7), coordinator.getComponent(prop, TransformComponent.class).position);
    }

    @Test
    void defaultGravity() {
        assertEquals(PhysicsSystem.DEFAULT_GRAVITY, physics.getGravity());
        assertEquals(1.62, new PhysicsSystem(1.62).getGravity());
    }
}
