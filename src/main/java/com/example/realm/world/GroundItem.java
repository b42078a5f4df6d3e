package com.example.realm.world;

/**
 * A stack lying on a tile. Never blocks movement. While {@link #ownerId()} is set, only that player may
 * pick it up, until {@link #ownerUntil()}.
 */
public class GroundItem extends Entity {
    public final int itemId;
    public final long droppedAt;
    public final long expiresAt;
    private int quantity;
    private long ownerId;
    private long ownerUntil;

    public GroundItem(long id, int itemId, int quantity, long droppedAt, long expiresAt) {
        super(id);
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be positive: " + quantity);
        this.itemId = itemId;
        this.quantity = quantity;
        this.droppedAt = droppedAt;
        this.expiresAt = expiresAt;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ITEM;
    }

    public int quantity() {
        return quantity;
    }

    /** Removes up to {@code amount} and returns what is left. */
    public int take(int amount) {
        quantity = Math.max(0, quantity - amount);
        return quantity;
    }

    public long ownerId() {
        return ownerId;
    }

    public long ownerUntil() {
        return ownerUntil;
    }

    public void reserveFor(long playerId, long until) {
        this.ownerId = playerId;
        this.ownerUntil = until;
    }

    public void clearOwner() {
        this.ownerId = 0;
        this.ownerUntil = 0;
    }

    public boolean isReservedAgainst(long playerId, long now) {
        return ownerId != 0 && ownerId != playerId && now < ownerUntil;
    }

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }
}
