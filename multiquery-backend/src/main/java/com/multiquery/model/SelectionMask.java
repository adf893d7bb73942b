package com.multiquery.model;

import lombok.Value;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which backends a single query is dispatched to.
 *
 * <p>The mask is resolved against the registered backends by
 * {@link com.multiquery.service.BackendRegistry#resolve(SelectionMask)}.
 */
@Value
public class SelectionMask {

    public enum Mode {
        ALL,
        INCLUDE,
        EXCLUDE
    }

    Mode mode;
    Set<BackendId> backends;

    private SelectionMask(Mode mode, Collection<BackendId> backends) {
        this.mode = mode;
        this.backends = Collections.unmodifiableSet(new LinkedHashSet<>(backends));
    }

    public static SelectionMask all() {
        return new SelectionMask(Mode.ALL, Set.of());
    }

    public static SelectionMask include(Collection<BackendId> backends) {
        return new SelectionMask(Mode.INCLUDE, backends != null ? backends : Set.of());
    }

    public static SelectionMask include(BackendId... backends) {
        return include(Arrays.asList(backends));
    }

    public static SelectionMask exclude(Collection<BackendId> backends) {
        return new SelectionMask(Mode.EXCLUDE, backends != null ? backends : Set.of());
    }

    public static SelectionMask exclude(BackendId... backends) {
        return exclude(Arrays.asList(backends));
    }

    /**
     * Whether a registered backend is selected by this mask.
     *
     * @param backend registered backend
     * @return true when the backend should receive the query
     */
    public boolean matches(BackendId backend) {
        switch (mode) {
            case ALL:
                return true;
            case INCLUDE:
                return backends.contains(backend);
            case EXCLUDE:
                return !backends.contains(backend);
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        if (mode == Mode.ALL) {
            return "all";
        }
        return mode.name().toLowerCase() + backends.stream()
                .map(BackendId::getValue)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
