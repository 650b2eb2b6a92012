package io.osquerymcp.core.compat;

import io.osquerymcp.core.args.ArgumentModel;
import io.osquerymcp.core.args.QueryInsightsParams;
import io.osquerymcp.core.registry.HttpVerb;
import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import io.osquerymcp.core.registry.UnknownToolException;
import io.osquerymcp.core.tools.ToolResult;
import io.osquerymcp.core.version.VersionRange;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

class CompatibilityGateTest {

    private ToolRegistry registry;
    private CompatibilityGate gate;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        gate = new CompatibilityGate(registry);
        register("Unbounded", null, VersionRange.unbounded());
        register("Insights", "QueryInsights", VersionRange.atLeast("2.12.0"));
        register("Legacy", null, VersionRange.atMost("1.3.0"));
        register("Window", null, VersionRange.between("1.0.0", "2.0.0"));
    }

    private void register(String name, String displayName, VersionRange range) {
        registry.register(new ToolDescriptor<>(name, displayName, "",
            ArgumentModel.of(QueryInsightsParams.class),
            args -> ToolResult.success(null), range, HttpVerb.of(HttpVerb.GET)));
    }

    @Test
    @DisplayName("tool without bounds is always compatible")
    void unboundedAlwaysOk() {
        assertTrue(gate.check("Unbounded", "0.0.1").compatible());
        assertTrue(gate.check("Unbounded", "not-a-version").compatible());
    }

    @Test
    @DisplayName("version below minimum is rejected with the exact message")
    void belowMinimum() {
        CompatibilityResult result = gate.check("Insights", "2.11.0");

        assertTrue(result.isRejected());
        assertEquals("Tool 'QueryInsights' is not supported for this OpenSearch version "
            + "(current version: 2.11.0). Supported version: 2.12.0 or later.", result.reason());
    }

    @Test
    @DisplayName("minimum itself is accepted")
    void atMinimum() {
        assertTrue(gate.check("Insights", "2.12.0").compatible());
        assertTrue(gate.check("Insights", "2.12").compatible());
    }

    @Test
    @DisplayName("upper bound renders as 'up to'")
    void aboveMaximum() {
        CompatibilityResult result = gate.check("Legacy", "2.0.0");
        assertTrue(result.reason().endsWith("Supported version: up to 1.3.0."));
    }

    @Test
    @DisplayName("both bounds render as 'min to max'")
    void outsideWindow() {
        CompatibilityResult result = gate.check("Window", "3.0.0");
        assertTrue(result.reason().endsWith("Supported version: 1.0.0 to 2.0.0."));
    }

    @Test
    @DisplayName("unparseable cluster version is rejected, not thrown")
    void unparseableVersion() {
        CompatibilityResult result = gate.check("Insights", "banana");
        assertTrue(result.isRejected());
        assertTrue(result.reason().contains("(current version: banana)"));
    }

    @Test
    @DisplayName("unknown tool throws")
    void unknownTool() {
        assertThrows(UnknownToolException.class, () -> gate.check("Missing", "2.0.0"));
    }

    @Test
    @DisplayName("message omits the range sentence when unbounded")
    void messageWithoutRange() {
        assertEquals("Tool 'X' is not supported for this OpenSearch version (current version: 1.0.0).",
            CompatibilityGate.rejectionMessage("X", "1.0.0", VersionRange.unbounded()));
    }
}
