package org.pokernight.model.settlement;

import java.math.BigDecimal;

/**
 * Money a player put in and took out of one game. {@code cashOut} is null while
 * the player is still at the table.
 */
public record PlayerRecord(String userId, BigDecimal totalBuyIn, BigDecimal cashOut) {
}
