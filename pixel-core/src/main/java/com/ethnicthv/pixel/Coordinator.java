package com.ethnicthv.pixel;

import com.ethnicthv.pixel.core.ComponentNotFoundException;
import com.ethnicthv.pixel.core.components.Component;
import com.ethnicthv.pixel.core.components.ComponentPool;
import com.ethnicthv.pixel.core.components.ComponentSignature;
import com.ethnicthv.pixel.core.components.ComponentTypeRegistry;
import com.ethnicthv.pixel.core.components.IComponentPool;
import com.ethnicthv.pixel.core.entity.Entity;
import com.ethnicthv.pixel.core.entity.EntityCommandBuffer;
import com.ethnicthv.pixel.core.entity.SignatureTable;
import com.ethnicthv.pixel.core.index.GroupIndex;
import com.ethnicthv.pixel.core.index.TagIndex;
import com.ethnicthv.pixel.core.system.ISystem;
import com.ethnicthv.pixel.core.system.SystemRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Coordinator - the single entry point (Facade) for the Entity Component System.
 * <p>
 * Owns entity id allocation, the component pools, the registered systems, the per-entity
 * signatures and the tag/group indices. Two kinds of mutation exist:
 * <ul>
 *   <li>Immediate: component add/remove, tag and group changes.</li>
 *   <li>Deferred: {@link #create()} and {@link #destroy(Entity)} are staged and only committed by
 *   {@link #update()}, which must run once per step before any system updates.</li>
 * </ul>
 * A just-created entity is therefore not visible to systems, and a just-destroyed entity keeps its
 * components, until the next {@code update()}. Not thread-safe; callers serialize access.
 */
public final class Coordinator implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(Coordinator.class);

    private final CoordinatorConfig config;

    // Entity management
    private int numEntities = 0;
    private final Deque<Integer> freeIds = new ArrayDeque<>();
    private final BitSet alive = new BitSet();
    private final EntityCommandBuffer commands = new EntityCommandBuffer();

    // Component management: [list index = component type id]
    private final ComponentTypeRegistry componentTypes = new ComponentTypeRegistry();
    private final List<IComponentPool> componentPools = new ArrayList<>();
    private final SignatureTable signatures;

    private final SystemRegistry systems = new SystemRegistry();

    private final TagIndex tags = new TagIndex();
    private final GroupIndex groups = new GroupIndex();

    public Coordinator() {
        this(CoordinatorConfig.defaults());
    }

    public Coordinator(CoordinatorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.signatures = new SignatureTable(config.initialEntityCapacity());
        for (Class<? extends Component> componentClass : config.components()) {
            registerComponent(componentClass);
        }
        LOG.info("Coordinator created (poolCapacity={}, entityCapacity={}, rescanOnSystemAdd={}, components={})",
                config.initialPoolCapacity(), config.initialEntityCapacity(),
                config.rescanOnSystemAdd(), config.components().size());
    }

    /**
     * Create a new Builder instance to configure the coordinator.
     */
    public static Builder builder() {
        return new Builder();
    }

    public CoordinatorConfig getConfig() {
        return config;
    }

    // =================================================================
    // Entity management
    // =================================================================

    /**
     * Allocate an entity and stage it for creation. Freed ids are reused oldest first.
     * The entity joins matching systems at the next {@link #update()}.
     */
    public Entity create() {
        int entityId;
        Integer reused = freeIds.pollFirst();
        if (reused == null) {
            entityId = numEntities++;
            signatures.ensureCapacity(entityId);
        } else {
            entityId = reused;
        }

        Entity entity = new Entity(entityId);
        commands.stageCreate(entity);
        LOG.debug("Entity created with id = {}", entityId);
        return entity;
    }

    /**
     * Stage the entity for destruction. Pools, signature and system membership are untouched
     * until the next {@link #update()}, so this is safe while iterating a system's entities.
     */
    public void destroy(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        commands.stageDestroy(entity);
        LOG.debug("Entity {} staged for destruction", entity.id());
    }

    /** True once the entity's creation has been committed and until its destruction is committed. */
    public boolean isAlive(Entity entity) {
        return entity != null && alive.get(entity.id());
    }

    public boolean isPendingCreation(Entity entity) {
        return commands.isPendingCreation(entity);
    }

    public boolean isPendingDestruction(Entity entity) {
        return commands.isPendingDestruction(entity);
    }

    /** Number of live (committed) entities. */
    public int getEntityCount() {
        return alive.cardinality();
    }

    public ComponentSignature getSignature(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        return signatures.get(entity.id());
    }

    // =================================================================
    // Component management
    // =================================================================

    /**
     * Register a component class with this coordinator, returning its type id. Idempotent.
     * Types are also registered lazily by {@link #addComponent} and by system requirements.
     */
    public int registerComponent(Class<? extends Component> componentClass) {
        return componentTypes.register(componentClass);
    }

    public ComponentTypeRegistry getComponentTypes() {
        return componentTypes;
    }

    /**
     * Attach {@code component} to the entity as type {@code componentClass}, replacing any existing
     * component of that type in place. Takes effect immediately.
     *
     * @throws IllegalArgumentException if the entity is neither live nor pending creation
     */
    public <T extends Component> void addComponent(Entity entity, Class<T> componentClass, T component) {
        Objects.requireNonNull(componentClass, "componentClass");
        Objects.requireNonNull(component, "component");
        requireUsable(entity);

        final int componentId = registerComponent(componentClass);
        final int entityId = entity.id();

        // Resize the pool list if necessary to accommodate the component id
        while (componentPools.size() <= componentId) {
            componentPools.add(null);
        }
        if (componentPools.get(componentId) == null) {
            componentPools.set(componentId, new ComponentPool<>(componentClass, config.initialPoolCapacity()));
            LOG.debug("Created component pool for {} (id {})", componentClass.getSimpleName(), componentId);
        }

        ComponentPool<T> pool = typedPool(componentId, componentClass);
        pool.set(entityId, component);

        ComponentSignature before = signatures.get(entityId);
        ComponentSignature after = before.set(componentId);
        if (after != before) {
            signatures.set(entityId, after);
            markDirtyIfAlive(entity);
        }
    }

    /**
     * Attach a component using its runtime class as the component type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Component> void addComponent(Entity entity, T component) {
        Objects.requireNonNull(component, "component");
        addComponent(entity, (Class<T>) component.getClass(), component);
    }

    /**
     * Detach the component of the given type. No-op if the type was never used or the entity lacks it.
     */
    public <T extends Component> void removeComponent(Entity entity, Class<T> componentClass) {
        Objects.requireNonNull(entity, "entity");
        ComponentPool<T> pool = poolOrNull(componentClass);
        if (pool == null || !pool.has(entity.id())) {
            return;
        }
        pool.remove(entity.id());

        int componentId = componentTypes.getTypeId(componentClass);
        signatures.set(entity.id(), signatures.get(entity.id()).clear(componentId));
        markDirtyIfAlive(entity);
    }

    public <T extends Component> boolean hasComponent(Entity entity, Class<T> componentClass) {
        Objects.requireNonNull(entity, "entity");
        Integer componentId = componentTypes.getTypeId(componentClass);
        return componentId != null && signatures.get(entity.id()).has(componentId);
    }

    /**
     * Direct access to the stored component; mutations are visible to every later reader.
     *
     * @throws ComponentNotFoundException if the entity does not carry the component
     */
    public <T extends Component> T getComponent(Entity entity, Class<T> componentClass) {
        Objects.requireNonNull(entity, "entity");
        ComponentPool<T> pool = poolOrNull(componentClass);
        if (pool == null) {
            throw new ComponentNotFoundException(entity.id(), componentClass);
        }
        return pool.get(entity.id());
    }

    public <T extends Component> Optional<T> findComponent(Entity entity, Class<T> componentClass) {
        Objects.requireNonNull(entity, "entity");
        ComponentPool<T> pool = poolOrNull(componentClass);
        return pool == null ? Optional.empty() : pool.find(entity.id());
    }

    /** The pool for a component type, if one has been created. */
    public <T extends Component> Optional<ComponentPool<T>> getComponentPool(Class<T> componentClass) {
        return Optional.ofNullable(poolOrNull(componentClass));
    }

    private <T extends Component> ComponentPool<T> poolOrNull(Class<T> componentClass) {
        Objects.requireNonNull(componentClass, "componentClass");
        Integer componentId = componentTypes.getTypeId(componentClass);
        if (componentId == null || componentId >= componentPools.size() || componentPools.get(componentId) == null) {
            return null;
        }
        return typedPool(componentId, componentClass);
    }

    private <T extends Component> ComponentPool<T> typedPool(int componentId, Class<T> componentClass) {
        IComponentPool handle = componentPools.get(componentId);
        if (!(handle instanceof ComponentPool)) {
            throw new IllegalStateException("Unexpected pool implementation at id " + componentId + ": " + handle);
        }
        return ((ComponentPool<?>) handle).cast(componentClass);
    }

    private void requireUsable(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        if (!alive.get(entity.id()) && !commands.isPendingCreation(entity)) {
            throw new IllegalArgumentException(entity + " is neither alive nor pending creation");
        }
    }

    private void markDirtyIfAlive(Entity entity) {
        if (alive.get(entity.id())) {
            commands.markDirty(entity);
        }
    }

    // =================================================================
    // System management
    // =================================================================

    /**
     * Register a system keyed by its class and call {@link ISystem#onAwake(Coordinator)}.
     * <p>
     * Adding a second instance of the same class replaces the first: the old instance is disposed
     * and its matched entities are discarded. With {@link CoordinatorConfig#rescanOnSystemAdd()}
     * the new instance is matched against every live entity right away; otherwise it only sees
     * entities created after this call.
     *
     * @return the registered system
     */
    public <T extends ISystem> T addSystem(T system) {
        if (system == null) {
            throw new IllegalArgumentException("System cannot be null");
        }
        system.onAwake(this);

        Optional<ISystem> previous = systems.add(system);
        if (previous.isPresent() && previous.get() != system) {
            ISystem old = previous.get();
            LOG.warn("Replacing system {}; {} matched entities of the previous instance are discarded",
                    system.getClass().getSimpleName(), old.getSystemEntities().size());
            old.clearEntities();
            old.onDispose();
        }

        if (config.rescanOnSystemAdd()) {
            system.clearEntities();
            for (int id = alive.nextSetBit(0); id >= 0; id = alive.nextSetBit(id + 1)) {
                if (signatures.get(id).containsAll(system.getComponentSignature())) {
                    system.addEntityToSystem(new Entity(id));
                }
            }
        }
        LOG.info("Registered system {} (signature={}, matched={})", system.getClass().getSimpleName(),
                system.getComponentSignature(), system.getSystemEntities().size());
        return system;
    }

    /**
     * Build a system from {@code factory} and register it under {@code systemClass}.
     *
     * @throws IllegalArgumentException if the factory yields null or an instance of another class
     */
    public <T extends ISystem> T addSystem(Class<T> systemClass, Supplier<? extends T> factory) {
        Objects.requireNonNull(systemClass, "systemClass");
        Objects.requireNonNull(factory, "factory");
        T system = factory.get();
        if (system == null || system.getClass() != systemClass) {
            throw new IllegalArgumentException("Factory for " + systemClass.getSimpleName()
                    + " produced " + (system == null ? "null" : system.getClass().getName()));
        }
        return addSystem(system);
    }

    public void removeSystem(Class<? extends ISystem> systemClass) {
        systems.remove(systemClass).ifPresent(removed -> {
            removed.clearEntities();
            removed.onDispose();
            LOG.info("Removed system {}", systemClass.getSimpleName());
        });
    }

    public boolean hasSystem(Class<? extends ISystem> systemClass) {
        return systems.has(systemClass);
    }

    /**
     * @throws com.ethnicthv.pixel.core.SystemNotFoundException if no system of that class is registered
     */
    public <T extends ISystem> T getSystem(Class<T> systemClass) {
        return systems.get(systemClass);
    }

    public <T extends ISystem> Optional<T> findSystem(Class<T> systemClass) {
        return systems.find(systemClass);
    }

    /** Snapshot of the registered systems in registration order. */
    public List<ISystem> getSystems() {
        return systems.getRegisteredSystems();
    }

    /**
     * Run every enabled system once, in registration order. Does not call {@link #update()}.
     */
    public void updateSystems(float deltaTime) {
        systems.updateSystems(deltaTime);
    }

    // =================================================================
    // Reconciliation
    // =================================================================

    /**
     * Commit staged structural changes. Call once per step, before systems update.
     * <ol>
     *   <li>Pending creations become live and join every system whose signature they satisfy.</li>
     *   <li>Live entities whose signature changed are re-evaluated against every system.</li>
     *   <li>Pending destructions leave all systems, lose their signature, components, tag and
     *   groups, and their id goes to the back of the free list.</li>
     * </ol>
     */
    public void update() {
        if (commands.isEmpty()) {
            return;
        }
        List<ISystem> registered = systems.getRegisteredSystems();

        List<Entity> created = commands.drainCreated();
        for (Entity entity : created) {
            alive.set(entity.id());
            addEntityToSystems(entity, registered);
        }

        List<Entity> dirty = commands.drainDirty();
        for (Entity entity : dirty) {
            if (alive.get(entity.id())) {
                refreshEntityInSystems(entity, registered);
            }
        }

        List<Entity> destroyed = commands.drainDestroyed();
        int reclaimed = 0;
        for (Entity entity : destroyed) {
            final int entityId = entity.id();
            if (!alive.get(entityId)) {
                LOG.debug("Ignoring destroy of {}: not alive", entity);
                continue;
            }
            removeEntityFromSystems(entity, registered);

            signatures.reset(entityId);
            for (IComponentPool pool : componentPools) {
                if (pool != null) {
                    pool.remove(entityId);
                }
            }
            tags.removeEntityTag(entity);
            groups.removeEntityGroups(entity);

            alive.clear(entityId);
            freeIds.addLast(entityId);
            reclaimed++;
        }

        LOG.debug("Reconciled: created={}, refreshed={}, destroyed={}", created.size(), dirty.size(), reclaimed);
    }

    private void addEntityToSystems(Entity entity, List<ISystem> registered) {
        ComponentSignature signature = signatures.get(entity.id());
        for (ISystem system : registered) {
            if (signature.containsAll(system.getComponentSignature())) {
                system.addEntityToSystem(entity);
            }
        }
    }

    private void refreshEntityInSystems(Entity entity, List<ISystem> registered) {
        ComponentSignature signature = signatures.get(entity.id());
        for (ISystem system : registered) {
            boolean interested = signature.containsAll(system.getComponentSignature());
            if (interested) {
                system.addEntityToSystem(entity);
            } else {
                system.removeEntityFromSystem(entity);
            }
        }
    }

    private void removeEntityFromSystems(Entity entity, List<ISystem> registered) {
        for (ISystem system : registered) {
            system.removeEntityFromSystem(entity);
        }
    }

    // =================================================================
    // Tag and group management
    // =================================================================

    /**
     * Bind a unique tag to the entity. No-op if the tag already names an entity.
     *
     * @throws IllegalArgumentException if the entity is neither live nor pending creation
     */
    public void tagEntity(Entity entity, String tag) {
        requireUsable(entity);
        if (!tags.tag(entity, tag)) {
            LOG.debug("Tag '{}' already assigned; {} not tagged", tag, entity);
        }
    }

    public boolean entityHasTag(Entity entity, String tag) {
        return tags.hasTag(entity, tag);
    }

    public Optional<Entity> getEntityByTag(String tag) {
        return tags.findEntity(tag);
    }

    public Optional<String> getEntityTag(Entity entity) {
        return tags.getTag(entity);
    }

    public void removeEntityTag(Entity entity) {
        tags.removeEntityTag(entity);
    }

    public void removeTag(String tag) {
        tags.removeTag(tag);
    }

    /**
     * @throws IllegalArgumentException if the entity is neither live nor pending creation
     */
    public void groupEntity(Entity entity, String group) {
        requireUsable(entity);
        groups.group(entity, group);
    }

    public boolean entityBelongsToGroup(Entity entity, String group) {
        return groups.belongsTo(entity, group);
    }

    /** Members of the group ordered by id; empty if the group does not exist. */
    public List<Entity> getEntitiesByGroup(String group) {
        return groups.getEntities(group);
    }

    public Set<String> getEntityGroups(Entity entity) {
        return groups.getGroups(entity);
    }

    public void removeEntityGroup(Entity entity, String group) {
        groups.removeEntityGroup(entity, group);
    }

    public void removeEntityGroups(Entity entity) {
        groups.removeEntityGroups(entity);
    }

    public void removeGroup(String group) {
        groups.removeGroup(group);
    }

    // =================================================================
    // Lifecycle
    // =================================================================

    /**
     * Dispose every system and drop all entity and component state.
     */
    @Override
    public void close() {
        for (ISystem system : systems.getRegisteredSystems()) {
            system.clearEntities();
            system.onDispose();
        }
        systems.clear();
        for (IComponentPool pool : componentPools) {
            if (pool != null) {
                pool.clear();
            }
        }
        componentPools.clear();
        commands.clear();
        tags.clear();
        groups.clear();
        alive.clear();
        freeIds.clear();
        signatures.clear();
        LOG.info("Coordinator closed ({} entity ids allocated)", numEntities);
        numEntities = 0;
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private int initialPoolCapacity = ComponentPool.DEFAULT_CAPACITY;
        private int initialEntityCapacity = CoordinatorConfig.DEFAULT_ENTITY_CAPACITY;
        private boolean rescanOnSystemAdd = true;
        private final List<Class<? extends Component>> components = new ArrayList<>();
        private final List<ISystem> systems = new ArrayList<>();

        /** Slots each component pool starts with. Pools grow by doubling. */
        public Builder initialPoolCapacity(int capacity) {
            this.initialPoolCapacity = capacity;
            return this;
        }

        /** Initial size of the per-entity signature table. */
        public Builder initialEntityCapacity(int capacity) {
            this.initialEntityCapacity = capacity;
            return this;
        }

        /**
         * Whether a newly added system is matched against already live entities.
         * Disable to only match entities created after the system was added.
         */
        public Builder rescanOnSystemAdd(boolean rescan) {
            this.rescanOnSystemAdd = rescan;
            return this;
        }

        /**
         * Register a component type at startup. Ids follow the registration order, which makes
         * them independent of which type happens to be used first.
         */
        public Builder registerComponent(Class<? extends Component> componentClass) {
            components.add(Objects.requireNonNull(componentClass, "componentClass"));
            return this;
        }

        /**
         * Add a system to be registered once the coordinator is built.
         */
        public Builder addSystem(ISystem system) {
            systems.add(Objects.requireNonNull(system, "system"));
            return this;
        }

        public Coordinator build() {
            CoordinatorConfig config = new CoordinatorConfig(
                    initialPoolCapacity, initialEntityCapacity, rescanOnSystemAdd, components);
            Coordinator coordinator = new Coordinator(config);
            for (ISystem system : systems) {
                coordinator.addSystem(system);
            }
            return coordinator;
        }
    }
}
