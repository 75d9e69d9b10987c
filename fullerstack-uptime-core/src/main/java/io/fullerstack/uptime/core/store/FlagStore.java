package io.fullerstack.uptime.core.store;

import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.FlagLookup;
import io.fullerstack.uptime.core.model.TargetKey;

/**
 * Durable presence store for down flags, partitioned by {@link TargetKey}.
 *
 * <h3>Implementation Notes:</h3>
 * <ul>
 *   <li>"Not found" on {@link #lookup} is {@link FlagLookup#absent()}, not an error</li>
 *   <li>Any other read failure is {@link FlagLookup#failed(String)}; lookup never throws</li>
 *   <li>{@link #create} and {@link #delete} are idempotent; deleting a missing flag is a no-op</li>
 *   <li>Write failures throw {@link FlagStoreException}</li>
 * </ul>
 *
 * @see io.fullerstack.uptime.core.reconcile.Reconciler
 */
public interface FlagStore {

    /**
     * Checks whether a down flag exists for the key.
     *
     * @param key target key
     * @return PRESENT, ABSENT, or FAILED with a description
     */
    FlagLookup lookup(TargetKey key);

    /**
     * Writes (or overwrites) the down flag.
     *
     * @param flag flag to persist
     * @throws FlagStoreException if the write fails
     */
    void create(DownFlag flag);

    /**
     * Removes the down flag for the key.
     *
     * @param key target key
     * @throws FlagStoreException if the delete fails for any reason other than "not found"
     */
    void delete(TargetKey key);
}
