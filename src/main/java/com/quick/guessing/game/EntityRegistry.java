package com.quick.guessing.game;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Concurrent unique-name registry of live entities.
 *
 * <p>Registration is a single atomic compare-and-insert on the backing map: a name is only
 * bound when it is free or its previous entity has been closed. Unregistering closes the
 * entity, so any holder of a stale handle gets {@link EntityUnavailableException}.
 */
@Slf4j
public class EntityRegistry<E extends Entity> {

    private final String kind;
    private final Map<String, Registration<E>> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    protected EntityRegistry(String kind) {
        this.kind = kind;
    }

    /**
     * @return {@code false} if a live entity already holds the name
     */
    public boolean register(String name, E entity) {
        Registration<E> candidate = new Registration<>(entity, sequence.incrementAndGet());
        Registration<E> bound = entries.compute(name,
                (key, existing) -> existing != null && existing.entity().isAlive() ? existing : candidate);
        if (bound != candidate) {
            log.debug("registry-taken kind={} name={}", kind, name);
            return false;
        }
        log.info("registry-add kind={} name={}", kind, name);
        return true;
    }

    /**
     * Returns the live entity bound to the name, creating and binding one if there is none.
     */
    public E registerIfAbsent(String name, Function<String, E> factory) {
        Registration<E> bound = entries.compute(name, (key, existing) -> {
            if (existing != null && existing.entity().isAlive()) {
                return existing;
            }
            log.info("registry-add kind={} name={}", kind, key);
            return new Registration<>(factory.apply(key), sequence.incrementAndGet());
        });
        return bound.entity();
    }

    public Optional<E> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Registration<E> entry = entries.get(name);
        if (entry == null || !entry.entity().isAlive()) {
            return Optional.empty();
        }
        return Optional.of(entry.entity());
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Removes and closes the entity bound to the name. Does nothing if the name is free.
     */
    public void unregister(String name) {
        Registration<E> removed = entries.remove(name);
        if (removed != null) {
            removed.entity().close();
            log.info("registry-remove kind={} name={}", kind, name);
        }
    }

    /**
     * Removes and closes the entity only while the name is still bound to it. A successor
     * registered under the same name is left alone.
     *
     * @return {@code false} if the name is free or bound to another entity
     */
    public boolean unregister(String name, E entity) {
        Registration<E> current = entries.get(name);
        if (current == null || current.entity() != entity || !entries.remove(name, current)) {
            return false;
        }
        entity.close();
        log.info("registry-remove kind={} name={}", kind, name);
        return true;
    }

    /**
     * Snapshot of the names bound to live entities, in no particular order.
     */
    public List<String> list() {
        List<String> names = new ArrayList<>();
        entries.forEach((name, entry) -> {
            if (entry.entity().isAlive()) {
                names.add(name);
            }
        });
        return names;
    }

    public List<E> entities() {
        return entries.values().stream()
                .map(Registration::entity)
                .filter(Entity::isAlive)
                .toList();
    }

    public void clear() {
        for (String name : new ArrayList<>(entries.keySet())) {
            unregister(name);
        }
    }

    /**
     * The most recently registered live entity.
     */
    public Optional<E> latest() {
        return entries.values().stream()
                .filter(entry -> entry.entity().isAlive())
                .max(Comparator.comparingLong(Registration::sequence))
                .map(Registration::entity);
    }

    private record Registration<E>(E entity, long sequence) {
    }
}
