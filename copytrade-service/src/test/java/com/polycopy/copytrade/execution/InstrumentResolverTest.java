package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.polymarket.clob.PolymarketClobClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InstrumentResolverTest {

    @Mock
    private PolymarketClobClient clobClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void cachesResolvedTokens() throws Exception {
        when(clobClient.getMarket("0xcond")).thenReturn(objectMapper.readTree("""
                {"tokens":[{"token_id":"111","outcome":"Yes"},{"token_id":"222","outcome":"No"}]}
                """));
        InstrumentResolver resolver = new InstrumentResolver(clobClient);

        assertThat(resolver.resolve("0xcond", "Yes")).contains("111");
        assertThat(resolver.resolve("0xcond", "yes")).contains("111");

        verify(clobClient, times(1)).getMarket("0xcond");
        assertThat(resolver.cachedInstruments()).isEqualTo(1);
    }

    @Test
    void missesAreNotCached() throws Exception {
        when(clobClient.getMarket("0xcond")).thenReturn(objectMapper.readTree("{\"tokens\":[]}"));
        InstrumentResolver resolver = new InstrumentResolver(clobClient);

        assertThat(resolver.resolve("0xcond", "Yes")).isEmpty();
        assertThat(resolver.resolve("0xcond", "Yes")).isEmpty();

        verify(clobClient, times(2)).getMarket("0xcond");
    }

    @Test
    void blankInputsSkipTheLookup() {
        InstrumentResolver resolver = new InstrumentResolver(clobClient);

        assertThat(resolver.resolve(" ", "Yes")).isEmpty();
        verify(clobClient, never()).getMarket(" ");
    }
}
