package com.ethnicthv.pixel.benchmark;

import com.ethnicthv.pixel.core.components.ComponentPool;
import com.ethnicthv.pixel.demo.TransformComponent;
import com.ethnicthv.pixel.demo.Vector2;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks for the dense component pool:
 * - swap-remove churn (remove every other entity, then re-add)
 * - dense iteration vs per-entity lookup
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@State(Scope.Thread)
public class ComponentPoolBenchmark {

    @Param({"1000", "10000"})
    public int entityCount;

    private ComponentPool<TransformComponent> pool;
    private TransformComponent[] values;

    @Setup(Level.Invocation)
    public void setup() {
        pool = new ComponentPool<>(TransformComponent.class);
        values = new TransformComponent[entityCount];
        for (int e = 0; e < entityCount; e++) {
            values[e] = new TransformComponent(new Vector2(e, e));
            pool.set(e, values[e]);
        }
    }

    @Benchmark
    public int removeAndReinsertHalf() {
        for (int e = 0; e < entityCount; e += 2) {
            pool.remove(e);
        }
        for (int e = 0; e < entityCount; e += 2) {
            pool.set(e, values[e]);
        }
        return pool.size();
    }

    @Benchmark
    public void denseIteration(Blackhole bh) {
        int n = pool.size();
        for (int i = 0; i < n; i++) {
            bh.consume(pool.getAt(i).position.x);
        }
    }

    @Benchmark
    public void lookupByEntity(Blackhole bh) {
        for (int e = 0; e < entityCount; e++) {
            bh.consume(pool.get(e).position.x);
        }
    }
}
