package io.endsession.core.pipeline;

import io.endsession.core.error.HandlerRegistrationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of named handlers per stage.
 *
 * <p>
 * Registration is by name: registering a descriptor whose name is already present replaces
 * the previous one (last-write-wins), and the replacement is ordered as a fresh registration.
 * Chains are sorted by priority, then by registration order, so resolution is fully
 * deterministic for a given registry content.
 *
 * <p>
 * With strict ordering enabled, two differently-named descriptors may not share the same stage
 * and priority; the second registration fails with {@link HandlerRegistrationException}.
 *
 * <p>
 * Thread-safe: the registry holds an immutable {@link Snapshot} in an {@link AtomicReference}
 * and every mutation swaps in a new snapshot. {@link #resolve(Stage)} never blocks and never
 * observes a half-applied change.
 */
public final class HandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(HandlerRegistry.class);

    private static final Comparator<Registration> CHAIN_ORDER =
            Comparator.comparingInt((Registration r) -> r.descriptor().priority())
                    .thenComparingLong(Registration::sequence);

    private final boolean strictOrdering;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<Snapshot> snapshotRef = new AtomicReference<>(Snapshot.EMPTY);

    /** Creates a registry that orders priority ties by registration order. */
    public HandlerRegistry() {
        this(false);
    }

    /**
     * @param strictOrdering when true, same-stage same-priority descriptors with different names
     *                       are rejected
     */
    public HandlerRegistry(boolean strictOrdering) {
        this.strictOrdering = strictOrdering;
    }

    /**
     * Registers a handler, replacing any handler with the same name.
     *
     * @param descriptor the handler to register
     * @return this registry (fluent)
     * @throws NullPointerException         if descriptor is null
     * @throws HandlerRegistrationException under strict ordering, on a priority collision
     */
    public HandlerRegistry register(HandlerDescriptor<?> descriptor) {
        if (descriptor == null) {
            throw new NullPointerException("descriptor must not be null");
        }
        long seq = sequence.incrementAndGet();
        Snapshot updated = snapshotRef.updateAndGet(old -> {
            if (strictOrdering) {
                checkCollision(old, descriptor);
            }
            Map<String, Registration> byName = new HashMap<>(old.byName());
            byName.put(descriptor.name(), new Registration(descriptor, seq));
            return Snapshot.of(byName);
        });
        LOG.debug(
                "Handler registered: name={}, stage={}, priority={}, handlers={}",
                descriptor.name(),
                descriptor.stage(),
                descriptor.priority(),
                updated.byName().size());
        return this;
    }

    /**
     * Removes the handler with the given name.
     *
     * @return {@code true} if a handler was removed
     */
    public boolean remove(String name) {
        Snapshot before = snapshotRef.getAndUpdate(old -> {
            if (!old.byName().containsKey(name)) {
                return old;
            }
            Map<String, Registration> byName = new HashMap<>(old.byName());
            byName.remove(name);
            return Snapshot.of(byName);
        });
        boolean removed = before.byName().containsKey(name);
        if (removed) {
            LOG.debug("Handler removed: name={}", name);
        }
        return removed;
    }

    /**
     * Returns the ordered chain for a stage. Pure: repeated calls on an unchanged registry return
     * equal lists.
     *
     * @param stage the stage
     * @return an immutable, ordered list of descriptors (possibly empty)
     */
    public List<HandlerDescriptor<?>> resolve(Stage stage) {
        return snapshotRef.get().chains().getOrDefault(stage, List.of());
    }

    /** Returns {@code true} if a handler with the given name is registered. */
    public boolean contains(String name) {
        return snapshotRef.get().byName().containsKey(name);
    }

    /** Returns the number of registered handlers across all stages. */
    public int size() {
        return snapshotRef.get().byName().size();
    }

    public boolean isStrictOrdering() {
        return strictOrdering;
    }

    private static void checkCollision(Snapshot snapshot, HandlerDescriptor<?> candidate) {
        for (Registration existing : snapshot.byName().values()) {
            HandlerDescriptor<?> other = existing.descriptor();
            if (!other.name().equals(candidate.name())
                    && other.stage() == candidate.stage()
                    && other.priority() == candidate.priority()) {
                throw new HandlerRegistrationException("Handler '" + candidate.name() + "' collides with '"
                        + other.name() + "' on stage " + candidate.stage() + " at priority " + candidate.priority());
            }
        }
    }

    private record Registration(HandlerDescriptor<?> descriptor, long sequence) {}

    /** Immutable registry content with chains precomputed per stage. */
    private record Snapshot(Map<String, Registration> byName, Map<Stage, List<HandlerDescriptor<?>>> chains) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        static Snapshot of(Map<String, Registration> byName) {
            Map<Stage, List<Registration>> grouped = new EnumMap<>(Stage.class);
            for (Registration registration : byName.values()) {
                grouped.computeIfAbsent(registration.descriptor().stage(), s -> new ArrayList<>())
                        .add(registration);
            }
            Map<Stage, List<HandlerDescriptor<?>>> chains = new EnumMap<>(Stage.class);
            grouped.forEach((stage, registrations) -> {
                registrations.sort(CHAIN_ORDER);
                List<HandlerDescriptor<?>> chain = new ArrayList<>(registrations.size());
                registrations.forEach(r -> chain.add(r.descriptor()));
                chains.put(stage, Collections.unmodifiableList(chain));
            });
            return new Snapshot(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(chains));
        }
    }
}
