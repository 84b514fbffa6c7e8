package dao.b52.bridge.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
public class InitiateWithdrawalRequest {

    @NotBlank
    private String owner;           // host address (bech32)

    @NotBlank
    private String destination;     // settlement chain address

    @NotNull
    private BigInteger amount;      // base units
}
