package com.example.realm.logic.combat;

import java.util.ArrayList;
import java.util.List;

/** Splits a kill's experience and gold evenly; the killer gets whatever does not divide evenly. */
public final class RewardCalculator {
    private RewardCalculator() {}

    public record Share(long playerId, long exp, long gold) {}

    /**
     * @param group players entitled to a share, killer included; order is kept in the result
     */
    public static List<Share> split(long exp, long gold, long killerId, List<Long> group) {
        List<Long> members = new ArrayList<>(group);
        if (!members.contains(killerId)) members.add(killerId);

        int n = members.size();
        long expEach = exp / n;
        long goldEach = gold / n;
        long expRest = exp - expEach * n;
        long goldRest = gold - goldEach * n;

        List<Share> shares = new ArrayList<>(n);
        for (long id : members) {
            boolean killer = id == killerId;
            shares.add(new Share(id, expEach + (killer ? expRest : 0), goldEach + (killer ? goldRest : 0)));
        }
        return shares;
    }
}
