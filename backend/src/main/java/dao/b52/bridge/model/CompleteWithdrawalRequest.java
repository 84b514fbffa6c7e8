package dao.b52.bridge.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CompleteWithdrawalRequest {

    @NotBlank
    private String externalTxRef;   // settlement chain tx hash of the claim
}
