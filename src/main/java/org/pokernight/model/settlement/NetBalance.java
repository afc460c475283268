package org.pokernight.model.settlement;

/** Cash-out minus buy-in in cents. Positive means the player is owed money. */
public record NetBalance(String userId, long amount) {

    public NetBalance withAmount(long newAmount) {
        return new NetBalance(userId, newAmount);
    }
}
