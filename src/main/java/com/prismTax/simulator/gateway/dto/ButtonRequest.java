package com.prismTax.simulator.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ButtonRequest {

    @NotBlank(message = "buttonId cannot be blank")
    private String buttonId;
}
