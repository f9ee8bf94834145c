package com.z254.agora.api.dto;

import com.z254.agora.domain.model.DeliberationRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for starting a deliberation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliberateRequest {

    @NotBlank(message = "Thesis is required")
    @Size(max = 50000, message = "Thesis must be less than 50000 characters")
    private String thesis;

    @Size(max = 100000, message = "Context must be less than 100000 characters")
    private String context;

    /**
     * Backend models, exactly three when given. Defaults to a diverse set.
     */
    @Size(min = 3, max = 3, message = "Exactly 3 models are required")
    private List<@NotBlank(message = "Model identifiers must not be blank") String> models;

    /**
     * Convert to domain model. Empty backends are filled in with defaults by the job service.
     */
    public DeliberationRequest toDeliberationRequest() {
        return DeliberationRequest.builder()
                .thesis(thesis)
                .context(context)
                .backends(models != null ? new ArrayList<>(models) : new ArrayList<>())
                .build();
    }
}
