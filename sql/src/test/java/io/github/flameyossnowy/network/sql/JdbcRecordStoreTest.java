package io.github.flameyossnowy.network.sql;

import io.github.flameyossnowy.network.api.LinkedRecordSet;
import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.exceptions.NetworkConfigurationException;
import io.github.flameyossnowy.network.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.network.api.exceptions.StoreException;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.network.NodeType;
import io.github.flameyossnowy.network.api.network.RelationConfig;
import io.github.flameyossnowy.network.api.union.UnionView;
import io.github.flameyossnowy.network.sql.SqliteNetworkDatabase.Channel;
import io.github.flameyossnowy.network.sql.SqliteNetworkDatabase.Person;
import io.github.flameyossnowy.network.sql.SqliteNetworkDatabase.Show;
import io.github.flameyossnowy.network.sql.connections.SimpleConnectionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRecordStoreTest {
    @TempDir
    Path tempDir;

    SqliteNetworkDatabase database;

    @BeforeEach
    void setup() {
        database = new SqliteNetworkDatabase(tempDir);
    }

    @Test
    void connectionsCounts() {
        assertCounts("connections_out", 2, 1, 1, 0, 1);
        assertCounts("connections_in", 1, 0, 2, 2, 0);
        assertCounts("connections", 3, 1, 3, 2, 1);
    }

    @Test
    void contactsCounts() {
        assertCounts("contacts_out", 2, 1, 1, 0, 1);
        assertCounts("contacts_in", 1, 0, 2, 2, 0);
        assertCounts("contacts", 3, 1, 3, 2, 1);
    }

    @Test
    void acquaintancesOnlyFollowAcceptedInvites() {
        assertCounts("acquaintances_out", 1, 0, 0, 0, 1);
        assertCounts("acquaintances_in", 1, 0, 0, 1, 0);
        assertCounts("acquaintances", 2, 0, 0, 1, 1);
    }

    @Test
    void linksAreWrittenToTheJoinTable() {
        Person jane = database.person(2);
        Person jack = database.person(3);

        LinkedRecordSet<Person, Long> janeFriendsIn = database.people.links(jane, "friends_in");
        janeFriendsIn.link(jack);

        assertTrue(database.people.union(jane, "friends").includes(jack));
        RecordSet<Person, Long> jackFriendsOut = database.people.relation(jack, "friends_out");
        assertEquals(List.of("mary"), jackFriendsOut.stream().map(Person::name).collect(Collectors.toList()));

        assertTrue(janeFriendsIn.unlink(jack));
        assertFalse(janeFriendsIn.unlink(jack));
        assertTrue(database.people.union(jane, "friends").isEmpty());
    }

    @Test
    void acceptingAnInviteMakesColleaguesBothWays() {
        Person mary = database.person(2);
        Person vincent = database.person(4);
        database.execute("INSERT INTO invites (id, person_id, person_id_target, message, is_accepted) VALUES (?, ?, ?, ?, 0)",
            6L, 2L, 4L, "Hi");

        assertFalse(database.people.union(mary, "colleagues").includes(vincent));
        UnionView<SqliteNetworkDatabase.Invite, Long> invites = database.people.union(mary, "invites");
        assertFalse(invites.find(6L).accepted());

        database.execute("UPDATE invites SET is_accepted = 1 WHERE id = ?", 6L);

        assertTrue(database.people.union(mary, "colleagues").includes(vincent));
        assertTrue(database.people.union(vincent, "colleagues").includes(mary));
        assertEquals(1, database.people.union(mary, "colleagues").size());
    }

    @Test
    void unmappedEdgeModelIsAConfigurationError() {
        JdbcRecordStore peopleOnly = JdbcRecordStore.builder(database.connections)
            .register(SqliteNetworkDatabase.PERSON, rs -> new Person(rs.getLong("id"), rs.getString("name")))
            .build();
        NodeType.Builder<Person, Long> builder = NodeType.builder(SqliteNetworkDatabase.PERSON, peopleOnly);

        NetworkConfigurationException e = assertThrows(NetworkConfigurationException.class,
            () -> builder.declareNetwork("contacts", RelationConfig.builder().through(SqliteNetworkDatabase.INVITE).build()));
        assertEquals("invites_out", e.getRelationName());
    }

    @Test
    void payShowsUnionFilteredRelations() {
        Channel discovery = database.store.all(SqliteNetworkDatabase.CHANNEL).whereIdIn(List.of(1L)).get(0);
        Channel abc = database.store.all(SqliteNetworkDatabase.CHANNEL).whereIdIn(List.of(4L)).get(0);

        UnionView<Show, Long> payShows = database.channels.union(discovery, "pay_shows");
        assertEquals(3, payShows.size());
        assertEquals(Set.of("Dirty Jobs", "Mythbusters", "Deadliest Catch"), Set.copyOf(payShows.map(Show::name)));
        assertEquals(0, database.channels.union(abc, "pay_shows").size());
    }

    @Test
    void findAcrossChannelsIsAllOrNothing() {
        List<RecordSet<Show, Long>> shows = new ArrayList<>();
        for (Channel channel : database.store.all(SqliteNetworkDatabase.CHANNEL)) {
            shows.add(database.channels.relation(channel, "shows"));
        }
        UnionView<Show, Long> union = new UnionView<>(shows);

        assertEquals(7, union.find(0L, 1L, 2L, 3L, 4L, 5L, 6L).size());
        assertEquals("Deadliest Catch", union.find(2L).name());
        assertThrows(RecordNotFoundException.class, () -> union.find(2L, 3L, 4L, 900L));
        assertFalse(union.isLoaded());
    }

    @Test
    void largeIdLookupsAreBatched() {
        List<Long> ids = new ArrayList<>();
        for (long id = 1; id <= 1200; id++) ids.add(id);

        assertEquals(5, database.store.all(SqliteNetworkDatabase.PERSON).whereIdIn(ids).size());
    }

    @Test
    void missingTableRaisesStoreException() {
        record Ghost(Long id) {}
        EntityModel<Ghost, Long> ghost = EntityModel.builder(Ghost.class, Long.class)
            .table("ghosts")
            .id("id", Ghost::id)
            .build();
        JdbcRecordStore store = JdbcRecordStore.builder(database.connections)
            .register(ghost, rs -> new Ghost(rs.getLong("id")))
            .build();

        StoreException e = assertThrows(StoreException.class, () -> store.all(ghost).size());
        assertNotNull(e.getCause());
    }

    @Test
    void unregisteredModelIsRejected() {
        JdbcRecordStore empty = JdbcRecordStore.builder(new SimpleConnectionProvider("jdbc:sqlite::memory:")).build();
        assertThrows(IllegalArgumentException.class, () -> empty.all(SqliteNetworkDatabase.PERSON));
    }

    private void assertCounts(String relation, int... expected) {
        for (int i = 0; i < expected.length; i++) {
            Person person = database.person(i + 1);
            assertEquals(expected[i], database.people.relation(person, relation).size(), person.name() + "." + relation);
        }
    }
}
