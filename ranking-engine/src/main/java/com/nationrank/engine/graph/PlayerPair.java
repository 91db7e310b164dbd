package com.nationrank.engine.graph;

/**
 * Unordered pair of player ids, stored with {@code first < second}.
 */
public record PlayerPair(String first, String second) implements Comparable<PlayerPair> {

    public PlayerPair {
        if (first == null || second == null) {
            throw new IllegalArgumentException("Pair members are required");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("A player cannot pair with themselves: " + first);
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static PlayerPair of(String a, String b) {
        return new PlayerPair(a, b);
    }

    public boolean contains(String playerId) {
        return first.equals(playerId) || second.equals(playerId);
    }

    public String other(String playerId) {
        if (first.equals(playerId)) return second;
        if (second.equals(playerId)) return first;
        throw new IllegalArgumentException(playerId + " is not part of " + key());
    }

    public String key() {
        return first + "|" + second;
    }

    @Override
    public int compareTo(PlayerPair o) {
        int c = first.compareTo(o.first);
        return c != 0 ? c : second.compareTo(o.second);
    }
}
