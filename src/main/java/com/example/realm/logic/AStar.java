package com.example.realm.logic;

import com.example.realm.world.GridMap;
import com.example.realm.world.Point;

import java.util.*;
import java.util.function.BiPredicate;

/**
 * 4-directional A* with a Manhattan heuristic. The search gives up after expanding
 * {@code maxExpanded} nodes.
 */
public final class AStar {
    private record Node(int x, int y, int g, int f, Node parent) {}

    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    private AStar() {}

    /**
     * @param passable extra per-tile check on top of terrain (dynamic occupancy); the goal tile is
     *                 always accepted so a path can end on an occupied target
     * @return the path from start to goal, both included, or empty when none was found in budget
     */
    public static Optional<List<Point>> findPath(GridMap map, Point start, Point goal,
                                                 BiPredicate<Integer, Integer> passable, int maxExpanded) {
        if (!map.inBounds(start.x(), start.y()) || !map.isWalkable(goal.x(), goal.y())) return Optional.empty();
        if (start.equals(goal)) return Optional.of(List.of(start));

        PriorityQueue<Node> open = new PriorityQueue<>(Comparator.comparingInt(Node::f).thenComparingInt(n -> -n.g()));
        int[][] bestG = new int[map.w][map.h];
        for (int x = 0; x < map.w; x++) Arrays.fill(bestG[x], Integer.MAX_VALUE);

        open.add(new Node(start.x(), start.y(), 0, h(start.x(), start.y(), goal), null));
        bestG[start.x()][start.y()] = 0;

        int expanded = 0;
        while (!open.isEmpty()) {
            Node cur = open.poll();
            if (cur.x() == goal.x() && cur.y() == goal.y()) return Optional.of(reconstruct(cur));
            if (cur.g() > bestG[cur.x()][cur.y()]) continue;
            if (++expanded > maxExpanded) return Optional.empty();

            for (int i = 0; i < 4; i++) {
                int nx = cur.x() + DX[i];
                int ny = cur.y() + DY[i];
                if (!map.isWalkable(nx, ny)) continue;
                boolean isGoal = nx == goal.x() && ny == goal.y();
                if (!isGoal && !passable.test(nx, ny)) continue;

                int ng = cur.g() + 1;
                if (ng >= bestG[nx][ny]) continue;

                bestG[nx][ny] = ng;
                open.add(new Node(nx, ny, ng, ng + h(nx, ny, goal), cur));
            }
        }
        return Optional.empty();
    }

    /** First step along a path toward the goal, or empty when already there or no path exists. */
    public static Optional<Point> nextStep(GridMap map, Point start, Point goal,
                                           BiPredicate<Integer, Integer> passable, int maxExpanded) {
        return findPath(map, start, goal, passable, maxExpanded)
                .filter(path -> path.size() > 1)
                .map(path -> path.get(1));
    }

    private static int h(int x, int y, Point goal) {
        return Math.abs(x - goal.x()) + Math.abs(y - goal.y());
    }

    private static List<Point> reconstruct(Node goal) {
        ArrayList<Point> path = new ArrayList<>();
        Node n = goal;
        while (n != null) { path.add(new Point(n.x(), n.y())); n = n.parent(); }
        Collections.reverse(path);
        return path;
    }
}
