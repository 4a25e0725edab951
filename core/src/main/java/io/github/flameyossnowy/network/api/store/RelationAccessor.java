package io.github.flameyossnowy.network.api.store;

import io.github.flameyossnowy.network.api.RecordSet;
import org.jetbrains.annotations.Nullable;

/**
 * A declared relation, evaluated against one owner record.
 *
 * @param <N>   the owner type
 * @param <R>   the related record type
 * @param <RID> the related record's primary key type
 */
@FunctionalInterface
public interface RelationAccessor<N, R, RID> {
    @Nullable
    RecordSet<R, RID> fetch(N owner);
}
