package dao.b52.bridge.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SignWithdrawalRequest {

    @NotBlank
    private String signerKey;       // 64 hex, optional 0x
}
