package com.flagship.otp_rental.rental.dto;

import com.flagship.otp_rental.rental.ServiceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartRentalRequest {

    @NotNull(message = "Service type is required")
    private ServiceType serviceType;

    /** Provider-specific carrier code, e.g. {@code VIETTEL}, {@code main_3} or {@code random}. */
    @NotBlank(message = "Carrier is required")
    @Size(max = 64, message = "Carrier must be at most 64 characters")
    private String carrier;
}
