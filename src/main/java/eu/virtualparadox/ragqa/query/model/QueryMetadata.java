package eu.virtualparadox.ragqa.query.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryMetadata(double retrievalTimeMs,
                            double generationTimeMs,
                            double totalTimeMs,
                            int chunksRetrieved) {

}
