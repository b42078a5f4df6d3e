package com.example.realm.content;

import com.example.realm.error.FatalStartupException;
import com.example.realm.world.Point;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ContentCatalog {
    private final Map<Integer, MapDefinition> maps;
    private final Map<Integer, NpcTemplate> npcs;
    private final Map<Integer, ItemTemplate> items;
    private final Map<Integer, SpellTemplate> spells;

    public ContentCatalog(List<MapDefinition> maps, List<NpcTemplate> npcs,
                          List<ItemTemplate> items, List<SpellTemplate> spells) {
        this.maps = index("map", maps, MapDefinition::id);
        this.npcs = index("npc", npcs, NpcTemplate::id);
        this.items = index("item", items, ItemTemplate::id);
        this.spells = index("spell", spells, SpellTemplate::id);
    }

    private static <T> Map<Integer, T> index(String what, List<T> values, Function<T, Integer> id) {
        Map<Integer, T> out = new LinkedHashMap<>();
        for (T v : values) {
            if (out.put(id.apply(v), v) != null) {
                throw new FatalStartupException("duplicate " + what + " id " + id.apply(v));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public Collection<MapDefinition> maps() { return maps.values(); }
    public Collection<NpcTemplate> npcs() { return npcs.values(); }

    public Optional<MapDefinition> map(int id) { return Optional.ofNullable(maps.get(id)); }
    public Optional<NpcTemplate> npc(int id) { return Optional.ofNullable(npcs.get(id)); }
    public Optional<ItemTemplate> item(int id) { return Optional.ofNullable(items.get(id)); }
    public Optional<SpellTemplate> spell(int id) { return Optional.ofNullable(spells.get(id)); }

    /**
     * Checks cross references so that a bad content set fails at startup instead of mid-game.
     *
     * @throws FatalStartupException on the first inconsistency found
     */
    public ContentCatalog validate(int goldItemId) {
        if (maps.isEmpty()) throw new FatalStartupException("no maps defined");
        if (!items.containsKey(goldItemId)) {
            throw new FatalStartupException("gold item " + goldItemId + " is not defined");
        }
        for (MapDefinition m : maps.values()) {
            if (m.width() <= 0 || m.height() <= 0) {
                throw new FatalStartupException("map " + m.id() + " has no area");
            }
            if (m.respawn() == null || !inside(m, m.respawn().x(), m.respawn().y())) {
                throw new FatalStartupException("map " + m.id() + " respawn point is outside the map");
            }
            for (MapDefinition.Spawn s : m.spawns()) {
                if (!npcs.containsKey(s.npcId())) {
                    throw new FatalStartupException("map " + m.id() + " spawns unknown npc " + s.npcId());
                }
                if (!inside(m, s.x(), s.y())) {
                    throw new FatalStartupException("map " + m.id() + " spawn of npc " + s.npcId() + " is outside the map");
                }
            }
            for (MapDefinition.Transition t : m.transitions()) {
                MapDefinition dest = maps.get(t.toMap());
                if (dest == null || !inside(m, t.x(), t.y()) || !inside(dest, t.toX(), t.toY())) {
                    throw new FatalStartupException("map " + m.id() + " has a broken transition at " + new Point(t.x(), t.y()));
                }
            }
        }
        for (NpcTemplate n : npcs.values()) {
            if (n.maxHp() <= 0) throw new FatalStartupException("npc " + n.id() + " has no hp");
            for (LootEntry e : n.loot()) {
                if (!items.containsKey(e.itemId())) {
                    throw new FatalStartupException("npc " + n.id() + " drops unknown item " + e.itemId());
                }
            }
        }
        return this;
    }

    private static boolean inside(MapDefinition m, int x, int y) {
        return x >= 0 && y >= 0 && x < m.width() && y < m.height();
    }
}
