package com.uitgo.proximity.model.param;

import com.uitgo.proximity.model.DriverStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateParam {
    
    @NotNull
    private DriverStatus status;
}
