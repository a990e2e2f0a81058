package org.carball.cablesizer.model.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CircuitFile {

    @JsonProperty("project")
    private String project;

    @JsonProperty("circuits")
    private List<CircuitDefinition> circuits = new ArrayList<>();
}
