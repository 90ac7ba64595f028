package com.phillippitts.champ.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void domainExceptionsAreUnchecked() {
        assertThat(new EndpointException("x")).isInstanceOf(ChampException.class).isInstanceOf(RuntimeException.class);
        assertThat(new LedgerException("x", new IOException())).isInstanceOf(ChampException.class);
        assertThat(new StreamException("x")).isInstanceOf(ChampException.class);
    }

    @Test
    void endpointExceptionCarriesEndpointName() {
        EndpointException ex = new EndpointException("Request failed", "mistral_7b", new IOException("reset"));

        assertThat(ex.getEndpointName()).isEqualTo("mistral_7b");
        assertThat(ex.getMessage()).isEqualTo("Request failed (endpoint: mistral_7b)");
        assertThat(ex.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void ledgerExceptionCarriesEntryPath() {
        Path entry = Path.of("rounds", "abc.json");
        LedgerException ex = new LedgerException("Failed to write round entry", entry, new IOException("disk full"));

        assertThat(ex.getEntryPath()).isEqualTo(entry);
        assertThat(ex.getMessage()).contains("abc.json");
    }
}
