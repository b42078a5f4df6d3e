package com.example.realm.world;

public record Point(int x, int y) {
    public Point step(Heading heading) {
        return new Point(x + heading.dx, y + heading.dy);
    }
}
