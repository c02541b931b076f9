package com.ethnicthv.pixel.core.system;

import com.ethnicthv.pixel.Coordinator;
import com.ethnicthv.pixel.core.components.ComponentSignature;
import com.ethnicthv.pixel.core.entity.Entity;

import java.util.List;

/**
 * ISystem - contract for systems registered with a {@link Coordinator}.
 *
 * Systems follow a simple lifecycle:
 * <ul>
 *     <li>{@link #onAwake(Coordinator)} - called once when the system is registered.</li>
 *     <li>{@link #onUpdate(float)} - called every frame while the system is enabled.</li>
 *     <li>{@link #onDispose()} - called when the system is removed, replaced, or the coordinator closes.</li>
 * </ul>
 * The matched-entity list is maintained by the coordinator during {@code update()}; systems only read it.
 */
public interface ISystem {

    /** Called once when the system is registered with a coordinator. */
    void onAwake(Coordinator coordinator);

    /**
     * Called once per frame / tick while the system is enabled.
     *
     * @param deltaTime time in seconds since last update
     */
    void onUpdate(float deltaTime);

    /** Called when the system is being disposed. */
    void onDispose();

    /** Whether this system should currently run. */
    boolean isEnabled();

    /** Enable or disable this system. Disabled systems are skipped by {@code updateSystems}. */
    void setEnabled(boolean enabled);

    /** Components an entity must carry to be matched by this system. */
    ComponentSignature getComponentSignature();

    /** Entities currently matched, in the order they were added. */
    List<Entity> getSystemEntities();

    void addEntityToSystem(Entity entity);

    void removeEntityFromSystem(Entity entity);

    boolean hasEntity(Entity entity);

    /** Forget every matched entity. */
    void clearEntities();
}
