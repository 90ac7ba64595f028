package com.phillippitts.champ.config.stream;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class StreamPropertiesTest {

    @Test
    void defaultsToBinanceTradeStreamForSymbol() {
        StreamProperties properties = new StreamProperties();
        properties.setSymbol("ETHUSDT");

        assertThat(properties.resolveUrl()).isEqualTo(URI.create("wss://stream.binance.com:9443/ws/ethusdt@trade"));
    }

    @Test
    void explicitUrlWins() {
        StreamProperties properties = new StreamProperties();
        properties.setUrl(" wss://feed.example.test/ws ");

        assertThat(properties.resolveUrl()).isEqualTo(URI.create("wss://feed.example.test/ws"));
    }
}
