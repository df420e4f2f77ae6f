package org.terrasim.core.generation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.terrasim.core.model.config.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

class StageProfileTest {

    @Test
    @DisplayName("Profiles resolve by name regardless of case")
    void byName() {
        assertTrue(StageProfile.byName("FULL").isEnabled(StageId.CLASSIFY));
        assertFalse(StageProfile.byName("terrainOnly").isEnabled(StageId.RIVERS));
        assertTrue(StageProfile.byName(" upToRivers ").isEnabled(StageId.RIVERS));
        assertFalse(StageProfile.byName("uptorivers").isEnabled(StageId.CLIMATE));
    }

    @Test
    @DisplayName("Unknown profile is a configuration error")
    void unknown() {
        assertThrows(ConfigurationException.class, () -> StageProfile.byName("airless"));
        assertThrows(ConfigurationException.class, () -> StageProfile.byName(null));
    }
}
