package com.ethnicthv.pixel.demo;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.entity.Entity;
import com.ethnicthv.pixel.core.system.BaseSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Multi-frame scenarios driven the way a game loop would: update(), then systems.
 */
@DisplayName("Frame loop scenarios")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class FrameLoopScenarioTest {

    /** Destroys anything that moved past a boundary, while iterating its own entity list. */
    static final class BoundarySystem extends BaseSystem {
        private final float maxX;
        final List<Entity> culled = new ArrayList<>();

        BoundarySystem(float maxX) {
            this.maxX = maxX;
            requireComponent(TransformComponent.class);
        }

        @Override
        public void onUpdate(float deltaTime) {
            for (Entity entity : getSystemEntities()) {
                if (coordinator.getComponent(entity, TransformComponent.class).position.x > maxX) {
                    coordinator.destroy(entity);
                    culled.add(entity);
                }
            }
        }
    }

    private static Entity spawn(Coordinator coordinator, float x, float vx) {
        Entity e = coordinator.create();
        coordinator.addComponent(e, new TransformComponent(new Vector2(x, 0)));
        coordinator.addComponent(e, new RigidBodyComponent(new Vector2(vx, 0)));
        return e;
    }

    @Test
    @Order(1)
    void entitiesLeavingTheBoundsAreRecycled() {
        try (Coordinator coordinator = Coordinator.builder()
                .addSystem(new PhysicsSystem())
                .addSystem(new BoundarySystem(10))
                .build()) {

            Entity fast = spawn(coordinator, 0, 6);
            Entity slow = spawn(coordinator, 0, 1);
            BoundarySystem boundary = coordinator.getSystem(BoundarySystem.class);

            // frame 1: both become live and move
            coordinator.update();
            coordinator.updateSystems(1f);
            assertEquals(2, coordinator.getSystem(PhysicsSystem.class).getSystemEntities().size());

            // frame 2: fast reaches 12 and is culled, but stays until next update
            coordinator.update();
            coordinator.updateSystems(1f);
            assertEquals(List.of(fast), boundary.culled);
            assertTrue(coordinator.isAlive(fast));

            // frame 3: reconciliation drops it everywhere and frees its id
            coordinator.update();
            assertFalse(coordinator.isAlive(fast));
            assertEquals(List.of(slow), coordinator.getSystem(PhysicsSystem.class).getSystemEntities());
            assertEquals(List.of(slow), boundary.getSystemEntities());

            Entity replacement = spawn(coordinator, 0, 0);
            assertEquals(fast.id(), replacement.id());
            coordinator.update();
            assertEquals(new Vector2(0, 0), coordinator.getComponent(replacement, TransformComponent.class).position);
        }
    }

    @Test
    @Order(2)
    void taggedPlayerSurvivesUntilDestroyed() {
        try (Coordinator coordinator = Coordinator.builder().addSystem(new PhysicsSystem()).build()) {
            Entity player = spawn(coordinator, 0, 2);
            coordinator.tagEntity(player, "player");
            coordinator.groupEntity(player, "actors");

            for (int i = 0; i < 3; i++) {
                coordinator.update();
                coordinator.updateSystems(1f);
            }

            Entity found = coordinator.getEntityByTag("player").orElseThrow();
            assertEquals(6f, coordinator.getComponent(found, TransformComponent.class).position.x);

            coordinator.destroy(found);
            coordinator.update();
            assertTrue(coordinator.getEntityByTag("player").isEmpty());
            assertTrue(coordinator.getEntitiesByGroup("actors").isEmpty());
        }
    }

    @Test
    @Order(3)
    void demoRunsToCompletion() {
        assertDoesNotThrow(() -> CoordinatorDemo.main(new String[]{"3"}));
    }
}
