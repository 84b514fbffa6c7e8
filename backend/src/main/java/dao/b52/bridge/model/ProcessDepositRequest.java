package dao.b52.bridge.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class ProcessDepositRequest {

    @NotNull
    @PositiveOrZero
    private Long index;

    /** Settlement chain block to read at; null or 0 reads at the current block. */
    @PositiveOrZero
    private Long externalHeight;
}
