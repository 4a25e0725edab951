package io.github.flameyossnowy.network.sql;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.meta.EntityRegistry;
import io.github.flameyossnowy.network.api.network.NodeType;
import io.github.flameyossnowy.network.api.network.RelationConfig;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.sql.connections.SimpleConnectionProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * A seeded SQLite file database with the person and channel networks declared on it.
 */
final class SqliteNetworkDatabase {
    record Person(Long id, String name) {}

    record Invite(Long id, Long personId, Long personIdTarget, String message, boolean accepted) {}

    record Channel(Long id, String name) {}

    record Show(Long id, String name, Long channelId, String packageName) {}

    static final EntityModel<Person, Long> PERSON = EntityModel.builder(Person.class, Long.class)
        .table("people")
        .id("id", Person::id)
        .column("name", Person::name)
        .build();

    static final EntityModel<Invite, Long> INVITE = EntityModel.builder(Invite.class, Long.class)
        .table("invites")
        .id("id", Invite::id)
        .column("person_id", Invite::personId)
        .column("person_id_target", Invite::personIdTarget)
        .column("message", Invite::message)
        .column("is_accepted", Invite::accepted)
        .build();

    static final EntityModel<Channel, Long> CHANNEL = EntityModel.builder(Channel.class, Long.class)
        .table("channels")
        .id("id", Channel::id)
        .column("name", Channel::name)
        .build();

    static final EntityModel<Show, Long> SHOW = EntityModel.builder(Show.class, Long.class)
        .table("shows")
        .id("id", Show::id)
        .column("name", Show::name)
        .column("channel_id", Show::channelId)
        .column("package", Show::packageName)
        .build();

    final SimpleConnectionProvider connections;
    final JdbcRecordStore store;
    final NodeType<Person, Long> people;
    final NodeType<Channel, Long> channels;

    SqliteNetworkDatabase(Path directory) {
        this.connections = new SimpleConnectionProvider("jdbc:sqlite:" + directory.resolve("network.db"));
        run("sql/schema.sql");
        run("sql/data.sql");

        this.store = JdbcRecordStore.builder(connections)
            .register(PERSON, rs -> new Person(rs.getLong("id"), rs.getString("name")))
            .register(INVITE, rs -> new Invite(
                rs.getLong("id"),
                rs.getLong("person_id"),
                rs.getLong("person_id_target"),
                rs.getString("message"),
                rs.getBoolean("is_accepted")))
            .register(CHANNEL, rs -> new Channel(rs.getLong("id"), rs.getString("name")))
            .register(SHOW, rs -> new Show(rs.getLong("id"), rs.getString("name"), rs.getLong("channel_id"), rs.getString("package")))
            .build();

        EntityRegistry registry = new EntityRegistry().add(PERSON).add(INVITE).add(CHANNEL).add(SHOW);
        RelationFilter accepted = RelationFilter.where("is_accepted").eq(true);

        this.people = NodeType.builder(PERSON, store, registry)
            .declareNetwork("connections", RelationConfig.defaults())
            .declareNetwork("friends", RelationConfig.builder()
                .joinTable("friends")
                .associationForeignKey("person_id_friend")
                .build())
            .declareNetwork("contacts", RelationConfig.builder().through("invites").build())
            .declareNetwork("acquaintances", RelationConfig.builder().through("invites").filter(accepted).build())
            .declareNetwork("colleagues", RelationConfig.builder()
                .through("invites")
                .foreignKey("person_id")
                .associationForeignKey("person_id_target")
                .filter(accepted)
                .build())
            .build();

        this.channels = NodeType.builder(CHANNEL, store, registry)
            .declareOneToMany("shows", SHOW, "channel_id", null)
            .declareOneToMany("premium_shows", SHOW, "channel_id", RelationFilter.where("package").eq("premium"))
            .declareOneToMany("mega_shows", SHOW, "channel_id", RelationFilter.where("package").eq("mega"))
            .declareUnion("pay_shows", "premium_shows", "mega_shows")
            .build();
    }

    Person person(long id) {
        return store.all(PERSON).whereIdIn(List.of(id)).get(0);
    }

    void execute(String sql, Object... parameters) {
        try (Connection connection = connections.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; i++) {
                statement.setObject(i + 1, parameters[i]);
            }
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to execute " + sql, e);
        }
    }

    void run(String resource) {
        String script;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("Missing script " + resource);
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }

        try (Connection connection = connections.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) statement.executeUpdate(sql);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to run " + resource, e);
        }
    }
}
