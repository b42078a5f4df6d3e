package com.example.realm.world;

/**
 * Anything that can be registered in the {@link WorldIndex}. Position is owned by the index:
 * only {@link WorldIndex} operations change it.
 */
public abstract class Entity {
    public final long id;
    private int mapId;
    private int x, y;

    protected Entity(long id) {
        this.id = id;
    }

    public abstract EntityKind kind();

    public boolean isBlocking() {
        return kind().isBlocking();
    }

    public int mapId() { return mapId; }
    public int x() { return x; }
    public int y() { return y; }

    public Point position() {
        return new Point(x, y);
    }

    void place(int mapId, int x, int y) {
        this.mapId = mapId;
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() {
        return kind() + "#" + id + "@" + mapId + ":" + x + "," + y;
    }
}
