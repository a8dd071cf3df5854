package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Factory for the stage definition selected on the command line
 */
@Slf4j
@Service
public class StageRegistry {

    private final CascadeProperties properties;

    public StageRegistry(CascadeProperties properties) {
        this.properties = properties;
    }

    /**
     * Names accepted by {@link #create(String, String)}
     */
    public List<String> stageNames() {
        return List.of(AcquisitionStage.NAME, FilteringStage.NAME, QuantificationStage.NAME);
    }

    /**
     * Create the stage definition for one invocation
     *
     * @param name stage name (case-insensitive)
     * @param index salmon index from the command line, overriding the configured one
     * @return the configured stage
     */
    public StageDefinition create(String name, String index) {
        if (name == null || name.isBlank()) {
            throw new InfrastructureException("No stage given; expected one of " + stageNames());
        }

        CascadeProperties.StagesConfig stages = properties.getStages();
        StageDefinition stage = switch (name.trim().toLowerCase()) {
            case AcquisitionStage.NAME -> new AcquisitionStage(stages.getAcquisition());
            case FilteringStage.NAME -> new FilteringStage(stages.getFiltering());
            case QuantificationStage.NAME -> {
                String indexPath = index != null ? index : stages.getQuantification().getIndex();
                yield new QuantificationStage(stages.getQuantification(),
                    indexPath != null ? Path.of(indexPath) : null);
            }
            default -> throw new InfrastructureException(
                "Unknown stage '" + name + "'; expected one of " + stageNames());
        };

        log.debug("Selected stage {}", stage.name());
        return stage;
    }
}
