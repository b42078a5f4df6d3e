package com.example.realm.world;

import com.example.realm.content.MapDefinition;

public class GridMap {
    public final int id;
    public final String name;
    public final int w;
    public final int h;
    private final boolean[][] blocked;

    public GridMap(int id, String name, int w, int h) {
        this.id = id;
        this.name = name;
        this.w = w;
        this.h = h;
        this.blocked = new boolean[w][h];
    }

    public static GridMap from(MapDefinition def) {
        GridMap m = new GridMap(def.id(), def.name(), def.width(), def.height());
        for (MapDefinition.Rect r : def.blocked()) {
            m.setBlockedRect(r.x1(), r.y1(), r.x2(), r.y2(), true);
        }
        return m;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < w && y < h;
    }

    public boolean isWalkable(int x, int y) {
        return inBounds(x, y) && !blocked[x][y];
    }

    public void setBlockedRect(int x1, int y1, int x2, int y2, boolean value) {
        for (int x = Math.min(x1, x2); x <= Math.max(x1, x2); x++) {
            for (int y = Math.min(y1, y2); y <= Math.max(y1, y2); y++) {
                if (inBounds(x, y)) blocked[x][y] = value;
            }
        }
    }

    public void setBlocked(int x, int y, boolean value) {
        setBlockedRect(x, y, x, y, value);
    }
}
