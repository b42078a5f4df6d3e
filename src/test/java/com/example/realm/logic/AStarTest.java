package com.example.realm.logic;

import com.example.realm.world.GridMap;
import com.example.realm.world.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AStarTest {

    private static GridMap walled() {
        // wall on x=5 from y=0 to y=8, gap at y=9
        GridMap map = new GridMap(1, "m", 10, 10);
        map.setBlockedRect(5, 0, 5, 8, true);
        return map;
    }

    @Test
    void findsShortestPathAroundWall() {
        GridMap map = walled();

        List<Point> path = AStar.findPath(map, new Point(2, 2), new Point(8, 2), (x, y) -> true, 500).orElseThrow();

        assertThat(path.get(0)).isEqualTo(new Point(2, 2));
        assertThat(path.get(path.size() - 1)).isEqualTo(new Point(8, 2));
        assertThat(path).contains(new Point(5, 9));
        assertThat(path).hasSize(21);
        for (int i = 1; i < path.size(); i++) {
            Point a = path.get(i - 1);
            Point b = path.get(i);
            assertThat(Math.abs(a.x() - b.x()) + Math.abs(a.y() - b.y())).isEqualTo(1);
            assertThat(map.isWalkable(b.x(), b.y())).isTrue();
        }
    }

    @Test
    void givesUpWhenSearchBudgetRunsOut() {
        assertThat(AStar.findPath(walled(), new Point(2, 2), new Point(8, 2), (x, y) -> true, 5)).isEmpty();
    }

    @Test
    void dynamicBlockersAreRespectedButGoalIsAccepted() {
        GridMap map = walled();

        Optional<List<Point>> path = AStar.findPath(map, new Point(2, 2), new Point(8, 2),
                (x, y) -> !(x == 5 && y == 9), 500);
        assertThat(path).isEmpty();

        Optional<List<Point>> toOccupiedGoal = AStar.findPath(map, new Point(2, 2), new Point(3, 2),
                (x, y) -> !(x == 3 && y == 2), 500);
        assertThat(toOccupiedGoal).contains(List.of(new Point(2, 2), new Point(3, 2)));
    }

    @Test
    void blockedGoalHasNoPath() {
        assertThat(AStar.findPath(walled(), new Point(2, 2), new Point(5, 3), (x, y) -> true, 500)).isEmpty();
    }
}
