package dev.corebanking.identity.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshResult {
    private String accessToken;
    @Builder.Default
    private String tokenType = "Bearer";
    private long expiresIn; // seconds
}
