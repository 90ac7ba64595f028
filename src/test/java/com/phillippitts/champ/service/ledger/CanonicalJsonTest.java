package com.phillippitts.champ.service.ledger;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.phillippitts.champ.service.ledger.LedgerFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonTest {

    @Test
    void writesSortedSnakeCaseKeysAndIsoTimestamps() {
        String json = new String(CanonicalJson.toBytes(record(1)), StandardCharsets.UTF_8);

        assertThat(json).startsWith("{\"context\":{\"price\":64001.0,\"round_id\":\"round_1\"");
        assertThat(json).contains("\"timestamp\":\"2024-06-10T06:13:50Z\"");
        assertThat(json).contains("\"endpoint_name\":\"llama3_8b\"");
        assertThat(json.indexOf("\"results\"")).isLessThan(json.lastIndexOf("\"round_id\""));
        assertThat(json).doesNotContain("\n");

        JSONObject parsed = new JSONObject(json);
        assertThat(parsed.getJSONArray("results")).hasSize(2);
        assertThat(parsed.getJSONArray("results").getJSONObject(1).getString("error")).isEqualTo("timeout");
    }

    @Test
    void mapInsertionOrderDoesNotAffectBytes() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", 1);
        second.put("b", 2);

        assertThat(CanonicalJson.toBytes(first)).isEqualTo(CanonicalJson.toBytes(second));
    }

    @Test
    void sha256MatchesKnownVector() {
        assertThat(Sha256.hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
