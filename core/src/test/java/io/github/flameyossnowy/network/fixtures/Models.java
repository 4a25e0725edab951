package io.github.flameyossnowy.network.fixtures;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.meta.EntityRegistry;
import io.github.flameyossnowy.network.api.network.NodeType;
import io.github.flameyossnowy.network.api.network.RelationConfig;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.store.RelationStore;

public final class Models {
    public static final EntityModel<Person, Long> PERSON = EntityModel.builder(Person.class, Long.class)
        .table("people")
        .id("id", Person::getId)
        .column("name", Person::getName)
        .build();

    public static final EntityModel<Invite, Long> INVITE = EntityModel.builder(Invite.class, Long.class)
        .table("invites")
        .id("id", Invite::getId)
        .column("person_id", Invite::getPersonId)
        .column("person_id_target", Invite::getPersonIdTarget)
        .column("message", Invite::getMessage)
        .column("is_accepted", Invite::isAccepted)
        .build();

    public static final EntityModel<Channel, Long> CHANNEL = EntityModel.builder(Channel.class, Long.class)
        .table("channels")
        .id("id", Channel::id)
        .column("name", Channel::name)
        .build();

    public static final EntityModel<Show, Long> SHOW = EntityModel.builder(Show.class, Long.class)
        .table("shows")
        .id("id", Show::id)
        .column("name", Show::name)
        .column("channel_id", Show::channelId)
        .column("package", Show::packageName)
        .build();

    public static final RelationFilter ACCEPTED = RelationFilter.where("is_accepted").eq(true);

    private Models() {}

    public static EntityRegistry registry() {
        return new EntityRegistry().add(PERSON).add(INVITE).add(CHANNEL).add(SHOW);
    }

    /**
     * The person networks used throughout the tests.
     */
    public static NodeType<Person, Long> people(RelationStore store) {
        return NodeType.builder(PERSON, store, registry())
            .declareNetwork("connections", RelationConfig.defaults())
            .declareNetwork("friends", RelationConfig.builder()
                .joinTable("friends")
                .associationForeignKey("person_id_friend")
                .build())
            .declareNetwork("contacts", RelationConfig.builder().through("invites").build())
            .declareNetwork("acquaintances", RelationConfig.builder()
                .through("invites")
                .filter(ACCEPTED)
                .build())
            .declareNetwork("colleagues", RelationConfig.builder()
                .through("invites")
                .foreignKey("person_id")
                .associationForeignKey("person_id_target")
                .filter(ACCEPTED)
                .build())
            .declareUnion("associates", "friends", "colleagues")
            .build();
    }

    public static NodeType<Channel, Long> channels(RelationStore store) {
        return NodeType.builder(CHANNEL, store, registry())
            .declareOneToMany("shows", SHOW, "channel_id", null)
            .declareOneToMany("premium_shows", SHOW, "channel_id", RelationFilter.where("package").eq("premium"))
            .declareOneToMany("mega_shows", SHOW, "channel_id", RelationFilter.where("package").eq("mega"))
            .declareUnion("pay_shows", "premium_shows", "mega_shows")
            .build();
    }
}
