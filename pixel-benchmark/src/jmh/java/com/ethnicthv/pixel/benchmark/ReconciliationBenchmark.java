package com.ethnicthv.pixel.benchmark;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.entity.Entity;
import com.ethnicthv.pixel.demo.PhysicsSystem;
import com.ethnicthv.pixel.demo.RigidBodyComponent;
import com.ethnicthv.pixel.demo.TransformComponent;
import com.ethnicthv.pixel.demo.Vector2;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Cost of committing a frame's worth of structural changes:
 * - a batch of creations matched against the registered systems
 * - a batch of destructions removed from systems, pools, tags and groups
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class ReconciliationBenchmark {

    @Param({"100", "1000"})
    public int batchSize;

    private Coordinator coordinator;
    private Entity[] live;

    @Setup(Level.Invocation)
    public void setup() {
        coordinator = Coordinator.builder()
                .registerComponent(TransformComponent.class)
                .registerComponent(RigidBodyComponent.class)
                .addSystem(new PhysicsSystem())
                .build();
        live = new Entity[batchSize];
        for (int i = 0; i < batchSize; i++) {
            live[i] = spawn(i);
            coordinator.groupEntity(live[i], "batch");
        }
        coordinator.update();
    }

    @TearDown(Level.Invocation)
    public void tearDown() {
        coordinator.close();
    }

    private Entity spawn(int i) {
        Entity e = coordinator.create();
        coordinator.addComponent(e, new TransformComponent(new Vector2(i, 0)));
        coordinator.addComponent(e, new RigidBodyComponent(new Vector2(1, 0)));
        return e;
    }

    @Benchmark
    public int createBatch() {
        for (int i = 0; i < batchSize; i++) {
            spawn(i);
        }
        coordinator.update();
        return coordinator.getEntityCount();
    }

    @Benchmark
    public int destroyBatch() {
        for (Entity e : live) {
            coordinator.destroy(e);
        }
        coordinator.update();
        return coordinator.getEntityCount();
    }
}
