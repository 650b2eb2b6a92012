package io.osquerymcp.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.osquerymcp.core.args.ArgumentModel;
import io.osquerymcp.core.args.ListIndicesParams;
import io.osquerymcp.core.args.ToolArguments;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class OsQueryObjectMappersTest {

    @Test
    @DisplayName("each call returns an independent mapper")
    void independentInstances() {
        ObjectMapper first = OsQueryObjectMappers.create();
        ObjectMapper second = OsQueryObjectMappers.create();

        assertNotSame(first, second);
        first.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        assertTrue(second.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    @DisplayName("argument binding tweaks do not leak into new mappers")
    void argumentModelDoesNotLeak() {
        ToolArguments<ListIndicesParams> bound = ArgumentModel.of(ListIndicesParams.class)
            .bind(Map.of("unexpected", 1));
        assertNotNull(bound.params());

        assertTrue(OsQueryObjectMappers.create().isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }
}
