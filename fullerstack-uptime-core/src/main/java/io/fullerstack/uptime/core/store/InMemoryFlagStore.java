package io.fullerstack.uptime.core.store;

import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.FlagLookup;
import io.fullerstack.uptime.core.model.TargetKey;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flag store kept in process memory.
 * <p>
 * Flags survive across runs only as long as the instance does. Useful for
 * embedding the monitor in a long-lived process and for tests.
 */
public class InMemoryFlagStore implements FlagStore {

    private final Map<TargetKey, DownFlag> flags = new ConcurrentHashMap<>();

    @Override
    public FlagLookup lookup(TargetKey key) {
        return FlagLookup.of(flags.containsKey(key));
    }

    @Override
    public void create(DownFlag flag) {
        flags.put(flag.key(), flag);
    }

    @Override
    public void delete(TargetKey key) {
        flags.remove(key);
    }

    public Optional<DownFlag> get(TargetKey key) {
        return Optional.ofNullable(flags.get(key));
    }

    public int size() {
        return flags.size();
    }
}
