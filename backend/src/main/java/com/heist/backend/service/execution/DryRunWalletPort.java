package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.model.Chain;
import com.heist.backend.model.PositionSnapshot;
import com.heist.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Random;
import java.util.UUID;

/**
 * Fabricated fills against an in-memory balance. Quotes follow a random walk
 * biased upwards so exits of every kind show up during a dry run.
 */
@Slf4j
@Component
public class DryRunWalletPort implements WalletPort {

    private final ExecutionProperties properties;
    private final Random random;
    private BigDecimal balanceUsd;

    public DryRunWalletPort(ExecutionProperties properties) {
        this.properties = properties;
        Long seed = properties.getDryRunFill().getSeed();
        this.random = seed != null ? new Random(seed) : new Random();
        this.balanceUsd = MoneyUtils.bd(properties.getWalletBalanceUsd());
    }

    @Override
    public synchronized Fill buy(String address, Chain chain, BigDecimal amountUsd) {
        BigDecimal amount = MoneyUtils.scale(amountUsd);
        if (amount.compareTo(balanceUsd) > 0) {
            throw new IllegalStateException("Dry-run balance " + balanceUsd + " below requested " + amount);
        }
        BigDecimal price = MoneyUtils.price(properties.getDryRunFill().getEntryPrice());
        BigDecimal tokens = MoneyUtils.divide(amount, price, MoneyUtils.PRICE_SCALE);
        balanceUsd = MoneyUtils.subtract(balanceUsd, amount);
        String txRef = txPrefix(chain) + shortId();
        log.info("🧪 DRY RUN buy {} on {} for ${} -> {} tokens", address, chain.tag(), amount, tokens);
        return new Fill(price, tokens, amount, txRef);
    }

    @Override
    public synchronized Fill sell(PositionSnapshot position) {
        BigDecimal price = position.getCurrentPrice() != null ? position.getCurrentPrice() : position.getEntryPrice();
        BigDecimal proceeds = MoneyUtils.multiply(position.getTokenAmount(), price);
        balanceUsd = MoneyUtils.add(balanceUsd, proceeds);
        String txRef = txPrefix(Chain.fromTag(position.getChain()).orElse(Chain.ETHEREUM)) + shortId() + "_SELL";
        return new Fill(price, position.getTokenAmount(), proceeds, txRef);
    }

    @Override
    public synchronized BigDecimal quote(PositionSnapshot position) {
        BigDecimal current = position.getCurrentPrice() != null ? position.getCurrentPrice() : position.getEntryPrice();
        ExecutionProperties.DryRunProperties walk = properties.getDryRunFill();
        double changePct = walk.getMinMovePct() + random.nextDouble() * (walk.getMaxMovePct() - walk.getMinMovePct());
        BigDecimal factor = BigDecimal.ONE.add(BigDecimal.valueOf(changePct).divide(MoneyUtils.HUNDRED));
        return MoneyUtils.price(current.multiply(factor));
    }

    @Override
    public synchronized BigDecimal balanceUsd() {
        return balanceUsd;
    }

    private static String txPrefix(Chain chain) {
        return chain == Chain.SOLANA ? "DRYRUN" : "0xDRYRUN";
    }

    private static String shortId() {
        return "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
