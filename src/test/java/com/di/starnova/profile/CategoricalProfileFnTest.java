package com.di.starnova.profile;

import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.di.starnova.StarNovaTestData.factSale;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CategoricalProfileFn Tests")
class CategoricalProfileFnTest {

    private static Row status(String status) {
        return factSale(1L, 1L, 1L, 1L, "o", 1, 1.0, 0.0, status);
    }

    @Test
    @DisplayName("Should report every accepted value in configured order, zeros included")
    void testFrequencies() {
        CategoricalProfileFn fn = new CategoricalProfileFn("order_status", List.of("shipped", "delivered", "canceled"));
        CategoricalProfileFn.Accum acc = fn.createAccumulator();
        for (String s : new String[] {"delivered", "delivered", "shipped", "refunded", null}) {
            fn.addInput(acc, status(s));
        }

        ColumnProfile profile = fn.extractOutput(acc);

        assertEquals(ColumnProfile.Kind.CATEGORICAL, profile.getKind());
        assertEquals(4, profile.getCount());
        assertEquals(1, profile.getNullCount());
        assertEquals(List.of("shipped", "delivered", "canceled"), new ArrayList<>(profile.getFrequencies().keySet()));
        assertEquals(1L, profile.getFrequencies().get("shipped"));
        assertEquals(2L, profile.getFrequencies().get("delivered"));
        assertEquals(0L, profile.getFrequencies().get("canceled"));
        assertFalse(profile.getFrequencies().containsKey("refunded"));
        assertNull(profile.getMean());
    }
}
