package io.trading.advstream.candle;

import io.trading.advstream.client.MessageCallback;
import io.trading.advstream.protocol.api.ProtocolException;
import io.trading.advstream.protocol.model.Candle;
import io.trading.advstream.protocol.model.CandleUpdate;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the stream of partial candle updates into completed candles.
 *
 * The candles channel repeatedly sends the in-progress candle of each product. A candle is
 * complete once an update with a later start time arrives for the same product; the
 * aggregator then emits the previous candle. Updates with an equal or older start replace
 * the tracked candle without emitting.
 */
public class CandleAggregator implements MessageCallback {

    private static final Logger LOGGER = LoggerFactory.getLogger(CandleAggregator.class);

    /** Candle bucket size of the candles channel, in seconds. */
    public static final long GRANULARITY_SECONDS = 300;

    private final CandleCallback callback;
    private final Clock clock;
    private final long granularitySeconds;

    private final Map<String, Candle> tracked = new HashMap<>();

    public CandleAggregator(CandleCallback callback) {
        this(callback, Clock.systemUTC(), GRANULARITY_SECONDS);
    }

    public CandleAggregator(CandleCallback callback, Clock clock, long granularitySeconds) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (granularitySeconds <= 0) {
            throw new IllegalArgumentException("granularitySeconds must be positive");
        }
        this.callback = callback;
        this.clock = clock;
        this.granularitySeconds = granularitySeconds;
    }

    @Override
    public synchronized void onMessage(Message message) {
        if (message.channel() != Channel.CANDLES) {
            return;
        }

        // Latest start per product; on a tie the later update in the frame wins
        Map<String, Candle> latest = new LinkedHashMap<>();
        for (CandleUpdate update : message.candleUpdates()) {
            Candle seen = latest.get(update.productId());
            if (seen == null || update.candle().start() >= seen.start()) {
                latest.put(update.productId(), update.candle());
            }
        }

        List<Map.Entry<String, Candle>> ordered = new ArrayList<>(latest.entrySet());
        ordered.sort(Comparator.comparingLong((Map.Entry<String, Candle> e) -> e.getValue().start()).reversed());

        for (Map.Entry<String, Candle> entry : ordered) {
            apply(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public void onError(ProtocolException error) {
        LOGGER.warn("Skipping unreadable frame: {}", error.getMessage());
    }

    /**
     * Returns the in-progress candle tracked for a product.
     */
    public synchronized Optional<Candle> current(String productId) {
        return Optional.ofNullable(tracked.get(productId));
    }

    private void apply(String productId, Candle candle) {
        Candle previous = tracked.put(productId, candle);
        if (previous != null && candle.start() > previous.start()) {
            long nowSeconds = clock.instant().getEpochSecond();
            long now = nowSeconds - nowSeconds % (2 * granularitySeconds);
            LOGGER.debug("{}: Candle {} completed", productId, previous.start());
            callback.onCandle(now, productId, previous);
        }
    }
}
