package com.example.realm.session;

import com.example.realm.protocol.WorldEvent;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.store.PlayerRecord;
import com.example.realm.support.RecordingChannel;
import com.example.realm.support.TestWorld;
import com.example.realm.world.Heading;
import com.example.realm.world.Npc;
import com.example.realm.world.NpcState;
import com.example.realm.world.Player;
import com.example.realm.world.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SessionServiceTest {
    private final TestWorld t = new TestWorld();

    @Test
    void loginWelcomesAndAnnouncesThePlayer() {
        Player watcher = t.login(2, 8, 8);
        RecordingChannel ch = new RecordingChannel();

        PlayerSession s = t.sessions.login(1, "alice", Optional.empty(), ch);

        assertThat(ch.events.get(0)).isInstanceOf(WorldEvent.Welcome.class);
        WorldEvent.Welcome welcome = (WorldEvent.Welcome) ch.events.get(0);
        assertThat(welcome.playerId()).isEqualTo(s.playerId());
        assertThat(welcome.mapId()).isEqualTo(TestWorld.FIELD);
        assertThat(new Point(welcome.x(), welcome.y())).isEqualTo(new Point(5, 5));
        assertThat(ch.of(WorldEvent.EntitySpawned.class))
                .extracting(e -> e.entity().id())
                .contains(watcher.id);
        assertThat(t.channel(2).of(WorldEvent.EntitySpawned.class))
                .extracting(e -> e.entity().id())
                .containsExactly(s.playerId());
    }

    @Test
    void reloginCarriesOverTheReplacedPlayersProgress() {
        Player first = t.login(1, 8, 8);
        first.gold = 500;
        first.level = 4;

        t.sessions.login(1, "user1", new RecordingChannel());

        Player p = t.sessions.player(1).orElseThrow();
        assertThat(p.id).isNotEqualTo(first.id);
        assertThat(p.gold).isEqualTo(500);
        assertThat(p.level).isEqualTo(4);
        assertThat(p.position()).isEqualTo(new Point(8, 8));
    }

    @Test
    void reconnectRightAfterDisconnectSeesTheUnsavedState() {
        Player first = t.login(1, 8, 8);
        first.gold = 500;
        t.store.down = true;

        t.sessions.disconnect(1);
        t.sessions.login(1, "user1", new RecordingChannel());

        assertThat(t.sessions.player(1).orElseThrow().gold).isEqualTo(500);
    }

    @Test
    void unreachableStoreStillLetsTheUserIn() {
        t.store.records.put(1L, new PlayerRecord(1, "alice", TestWorld.CAVE, 7, 7, 3, 40, 80, 120, 20, 60,
                70, 60, 250, 12, 11, List.of()));
        t.store.down = true;

        t.sessions.login(1, "alice", t.persistence.load(1), new RecordingChannel());

        Player p = t.sessions.player(1).orElseThrow();
        assertThat(p.mapId()).isEqualTo(TestWorld.FIELD);
        assertThat(p.level).isEqualTo(1);
        assertThat(p.hp()).isEqualTo(t.rules.maxHp());
    }

    @Test
    void restoredRecordKeepsPositionAndStats() {
        PlayerRecord saved = new PlayerRecord(1, "alice", TestWorld.CAVE, 7, 7, 3, 40, 80, 120, 20, 60,
                70, 60, 250, 12, 11, List.of(new PlayerRecord.Slot(4, TestWorld.APPLE, 3)));

        t.sessions.login(1, "alice", Optional.of(saved), new RecordingChannel());

        Player p = t.sessions.player(1).orElseThrow();
        assertThat(p.mapId()).isEqualTo(TestWorld.CAVE);
        assertThat(p.position()).isEqualTo(new Point(7, 7));
        assertThat(p.level).isEqualTo(3);
        assertThat(p.gold).isEqualTo(250);
        assertThat(p.hp()).isEqualTo(80);
        assertThat(p.maxHp()).isEqualTo(120);
        assertThat(p.inventory.count(TestWorld.APPLE)).isEqualTo(3);
    }

    @Test
    void secondLoginReplacesTheFirst() {
        RecordingChannel first = new RecordingChannel();
        RecordingChannel second = new RecordingChannel();
        long firstId = t.sessions.login(1, "alice", Optional.empty(), first).playerId();

        long secondId = t.sessions.login(1, "alice", Optional.empty(), second).playerId();

        assertThat(t.sessions.online()).isEqualTo(1);
        assertThat(t.world.players()).extracting(p -> p.id).containsExactly(secondId);
        assertThat(t.world.contains(firstId)).isFalse();
        assertThat(t.broadcast.isAttached(firstId)).isFalse();
        assertThat(t.sessions.disconnect(1, first)).isFalse();
        assertThat(t.sessions.online()).isEqualTo(1);
    }

    @Test
    void moveIsSeenByObservers() {
        Player p = t.login(1, 5, 5);
        t.login(2, 8, 8);

        assertThat(t.sessions.handle(1, new Command.Move(Heading.EAST))).isTrue();

        assertThat(p.position()).isEqualTo(new Point(6, 5));
        assertThat(p.heading()).isEqualTo(Heading.EAST);
        assertThat(t.channel(2).of(WorldEvent.EntityMoved.class))
                .singleElement()
                .satisfies(m -> assertThat(m.x()).isEqualTo(6));
    }

    @Test
    void rejectedMoveIsReportedOnlyToIssuer() {
        Player p = t.login(1, 9, 10);
        t.login(2, 8, 8);

        assertThat(t.sessions.handle(1, new Command.Move(Heading.EAST))).isFalse();

        assertThat(p.position()).isEqualTo(new Point(9, 10));
        assertThat(t.channel(1).of(WorldEvent.CommandRejected.class))
                .containsExactly(new WorldEvent.CommandRejected("move", "tile is blocked"));
        assertThat(t.channel(2).events).isEmpty();
    }

    @Test
    void cannotWalkIntoAnotherPlayer() {
        Player p = t.login(1, 5, 5);
        t.login(2, 6, 5);

        t.sessions.handle(1, new Command.Move(Heading.EAST));

        assertThat(p.position()).isEqualTo(new Point(5, 5));
        assertThat(t.channel(1).of(WorldEvent.CommandRejected.class))
                .singleElement()
                .satisfies(r -> assertThat(r.reason()).isEqualTo("tile is occupied"));
    }

    @Test
    void steppingOnAnExitChangesMap() {
        Player p = t.login(1, 38, 20);

        t.sessions.handle(1, new Command.Move(Heading.EAST));

        assertThat(p.mapId()).isEqualTo(TestWorld.CAVE);
        assertThat(p.position()).isEqualTo(new Point(2, 2));
        assertThat(t.world.rangeQuery(TestWorld.FIELD, 39, 20, 0)).isEmpty();
    }

    @Test
    void attackNeedsAdjacencyAndCooldown() {
        t.login(1, 5, 5);
        Npc goblin = t.spawn(TestWorld.GOBLIN, 7, 5);

        assertThat(t.sessions.handle(1, new Command.Attack(goblin.id))).isFalse();
        assertThat(t.sessions.handle(1, new Command.Move(Heading.EAST))).isTrue();
        assertThat(t.sessions.handle(1, new Command.Attack(goblin.id))).isTrue();
        assertThat(t.sessions.handle(1, new Command.Attack(goblin.id))).isFalse();

        t.clock.advance(1000);
        assertThat(t.sessions.handle(1, new Command.Attack(goblin.id))).isTrue();
        assertThat(t.channel(1).of(WorldEvent.CommandRejected.class))
                .extracting(WorldEvent.CommandRejected::reason)
                .containsExactly("target is not in reach", "too soon to attack again");
    }

    @Test
    void damageAndHealSpellsSpendMana() {
        Player p = t.login(1, 5, 5);
        Npc goblin = t.spawn(TestWorld.GOBLIN, 8, 5);

        assertThat(t.sessions.handle(1, new Command.Cast(TestWorld.MISSILE, goblin.id))).isTrue();
        assertThat(goblin.hp()).isEqualTo(20);
        assertThat(goblin.state()).isEqualTo(NpcState.AGGROED);
        assertThat(p.mana()).isEqualTo(45);

        p.setHp(50);
        assertThat(t.sessions.handle(1, new Command.Cast(TestWorld.HEAL, p.id))).isTrue();
        assertThat(p.hp()).isEqualTo(70);
        assertThat(p.mana()).isEqualTo(40);

        p.setMana(4);
        assertThat(t.sessions.handle(1, new Command.Cast(TestWorld.MISSILE, goblin.id))).isFalse();
        assertThat(goblin.hp()).isEqualTo(20);
    }

    @Test
    void disconnectCalmsNpcsAndSavesPlayer() {
        Player p = t.login(1, 5, 5);
        t.login(2, 8, 8);
        Npc goblin = t.spawn(TestWorld.GOBLIN, 7, 5);
        t.engine.tick(goblin, t.now());
        assertThat(goblin.targetId()).isEqualTo(p.id);

        assertThat(t.sessions.disconnect(1)).isTrue();

        assertThat(goblin.state()).isEqualTo(NpcState.IDLE);
        assertThat(goblin.hasTarget()).isFalse();
        assertThat(t.world.contains(p.id)).isFalse();
        assertThat(t.channel(2).of(WorldEvent.EntityDespawned.class))
                .containsExactly(new WorldEvent.EntityDespawned(p.id, DespawnReason.REMOVED));
        t.persistence.flush();
        assertThat(t.store.records).containsKey(1L);
        assertThat(t.sessions.disconnect(1)).isFalse();
    }

    @Test
    void commandsFromUnknownUsersAreIgnored() {
        assertThat(t.sessions.handle(42, new Command.Pickup())).isFalse();
    }
}
