package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.exception.StreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Parses Binance-style trade messages and publishes the latest price to a {@link MarketStateHolder}.
 *
 * <p>Expected payload: {@code {"e":"trade","s":"BTCUSDT","p":"64123.10","T":1718000000000, ...}}.
 * The trade time {@code T} is optional; the handler's clock is used when absent.
 *
 * <p>Malformed payloads raise {@link StreamException}, which the stream manager treats as a handler
 * failure.
 */
public class TradeFeedHandler implements MessageHandler {

    private static final Logger LOG = LogManager.getLogger(TradeFeedHandler.class);

    private final MarketStateHolder state;
    private final Clock clock;

    public TradeFeedHandler(MarketStateHolder state, Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onMessage(String message) {
        JSONObject trade;
        try {
            trade = new JSONObject(message);
        } catch (JSONException e) {
            throw new StreamException("Malformed trade message", e);
        }
        if (!trade.has("p")) {
            // subscription acks and other control frames carry no price
            LOG.debug("Ignoring non-trade message: keys={}", trade.keySet());
            return;
        }
        double price;
        try {
            price = Double.parseDouble(trade.get("p").toString());
        } catch (NumberFormatException e) {
            throw new StreamException("Trade price is not numeric: " + trade.get("p"), e);
        }
        String symbol = trade.optString("s", state.current().symbol());
        Instant at;
        try {
            at = trade.has("T") ? Instant.ofEpochMilli(trade.getLong("T")) : clock.instant();
        } catch (JSONException e) {
            throw new StreamException("Trade time is not numeric: " + trade.get("T"), e);
        }
        state.recordTrade(symbol, price, at);
    }
}
