package io.github.flameyossnowy.network.api.store;

/**
 * Join table of a self-referential many-to-many relation.
 *
 * @param table     join table name
 * @param localKey  column holding the owner's id
 * @param remoteKey column holding the related node's id
 */
public record JoinTableMapping(String table, String localKey, String remoteKey) {
    /**
     * The same table read from the other side.
     */
    public JoinTableMapping inverse() {
        return new JoinTableMapping(table, remoteKey, localKey);
    }
}
