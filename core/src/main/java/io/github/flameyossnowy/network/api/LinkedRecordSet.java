package io.github.flameyossnowy.network.api;

/**
 * A {@link RecordSet} backed by a join table, so membership can be changed by
 * inserting or deleting join rows.
 */
public interface LinkedRecordSet<T, ID> extends RecordSet<T, ID> {
    /**
     * Inserts a join row from the owner of this set to {@code other}.
     */
    void link(T other);

    /**
     * Deletes every join row from the owner of this set to {@code other}.
     *
     * @return whether any row was deleted
     */
    boolean unlink(T other);
}
