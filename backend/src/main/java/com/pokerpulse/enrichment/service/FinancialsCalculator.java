package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.model.Game;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived financial fields of a single game. Rake is charged on initial entries and rebuys; add-ons go to
 * the prize pool in full. Skipped when the buy-in is unknown.
 */
@Component
public class FinancialsCalculator {

    public boolean canCalculate(Game game) {
        return game.getBuyIn() != null && game.getBuyIn().signum() > 0;
    }

    public void apply(Game game) {
        if (!canCalculate(game)) {
            clear(game);
            return;
        }
        BigDecimal buyIn = game.getBuyIn();
        BigDecimal rake = nz(game.getRake());
        int initial = nz(game.getTotalInitialEntries());
        int rebuys = nz(game.getTotalRebuys());
        int addons = nz(game.getTotalAddons());
        if (game.getTotalEntries() == null || game.getTotalEntries() == 0) {
            int calculated = initial + rebuys + addons;
            if (calculated > 0) {
                game.setTotalEntries(calculated);
            }
        }
        int totalEntries = nz(game.getTotalEntries());
        BigDecimal rakedEntries = BigDecimal.valueOf((long) initial + rebuys);

        BigDecimal rakeRevenue = rake.multiply(rakedEntries);
        BigDecimal buyInsCollected = buyIn.multiply(BigDecimal.valueOf(totalEntries));
        BigDecimal contributions = buyIn.subtract(rake).multiply(rakedEntries)
                .add(buyIn.multiply(BigDecimal.valueOf(addons)));

        BigDecimal overlay = BigDecimal.ZERO;
        BigDecimal surplus = null;
        BigDecimal guarantee = game.getGuaranteeAmount();
        if (guarantee != null && guarantee.signum() > 0) {
            BigDecimal shortfall = guarantee.subtract(contributions);
            if (shortfall.signum() > 0) {
                overlay = shortfall;
            } else {
                surplus = shortfall.negate();
            }
        }

        game.setRakeRevenue(money(rakeRevenue));
        game.setTotalBuyInsCollected(money(buyInsCollected));
        game.setPrizepoolPlayerContributions(money(contributions));
        game.setGuaranteeOverlayCost(money(overlay));
        game.setPrizepoolSurplus(surplus == null ? null : money(surplus));
        game.setGameProfit(money(rakeRevenue.subtract(overlay)));
        game.setPrizepoolCalculated(contributions.signum() > 0 ? money(contributions.add(overlay)) : null);
    }

    private void clear(Game game) {
        game.setRakeRevenue(null);
        game.setTotalBuyInsCollected(null);
        game.setPrizepoolPlayerContributions(null);
        game.setGuaranteeOverlayCost(null);
        game.setPrizepoolSurplus(null);
        game.setGameProfit(null);
        game.setPrizepoolCalculated(null);
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }

    private static int nz(Integer v) {
        return v == null ? 0 : v;
    }
}
