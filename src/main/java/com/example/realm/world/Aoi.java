package com.example.realm.world;

public final class Aoi {
    private Aoi() {}

    public static int chebyshev(int x1, int y1, int x2, int y2) {
        return Math.max(Math.abs(x1 - x2), Math.abs(y1 - y2));
    }

    public static int manhattan(int x1, int y1, int x2, int y2) {
        return Math.abs(x1 - x2) + Math.abs(y1 - y2);
    }

    public static boolean inRange(Entity center, Entity other, int range) {
        return center.mapId() == other.mapId()
                && chebyshev(center.x(), center.y(), other.x(), other.y()) <= range;
    }

    public static boolean covers(Entity viewer, int mapId, int x, int y, int radius) {
        return viewer.mapId() == mapId && chebyshev(viewer.x(), viewer.y(), x, y) <= radius;
    }

    public static boolean adjacent(Entity a, Entity b) {
        return a.mapId() == b.mapId() && manhattan(a.x(), a.y(), b.x(), b.y()) == 1;
    }
}
