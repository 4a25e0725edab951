package io.github.flameyossnowy.network.api.store;

import io.github.flameyossnowy.network.api.LinkedRecordSet;

/**
 * Accessor of a join-table relation; the sets it hands out accept new links.
 */
@FunctionalInterface
public interface LinkAccessor<N, ID> extends RelationAccessor<N, N, ID> {
    @Override
    LinkedRecordSet<N, ID> fetch(N owner);
}
