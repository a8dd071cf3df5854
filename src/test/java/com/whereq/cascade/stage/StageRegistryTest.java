package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.exception.InfrastructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StageRegistryTest {

    private final CascadeProperties properties = new CascadeProperties();
    private final StageRegistry registry = new StageRegistry(properties);

    @Test
    @DisplayName("Should create each stage by name, ignoring case")
    void testCreate() {
        assertThat(registry.create("acquisition", null)).isInstanceOf(AcquisitionStage.class);
        assertThat(registry.create("Filtering", null)).isInstanceOf(FilteringStage.class);
        assertThat(registry.create(" QUANTIFICATION ", "/idx")).isInstanceOf(QuantificationStage.class);
    }

    @Test
    @DisplayName("Should prefer the command-line index over the configured one")
    void testIndexOverride() {
        // Given
        properties.getStages().getQuantification().setIndex("/configured/index");

        // When / Then
        assertThat(registry.create("quantification", "/cli/index").sharedResource()).isEqualTo(Path.of("/cli/index"));
        assertThat(registry.create("quantification", null).sharedResource()).isEqualTo(Path.of("/configured/index"));
    }

    @Test
    @DisplayName("Should reject unknown or missing stage names")
    void testUnknownStage() {
        assertThatThrownBy(() -> registry.create("alignment", null))
            .isInstanceOf(InfrastructureException.class)
            .hasMessageContaining("alignment")
            .hasMessageContaining("quantification");
        assertThatThrownBy(() -> registry.create(" ", null)).isInstanceOf(InfrastructureException.class);
    }
}
