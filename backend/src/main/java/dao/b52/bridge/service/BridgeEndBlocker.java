package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.config.WithdrawalProperties;
import dao.b52.bridge.exception.InvalidSignerKeyException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.host.EndBlocker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-block bridge work, in order: sequential deposit sync, gap scan, then signing of pending withdrawals
 * with the validator key (when one is configured).
 */
@Slf4j
@Component
public class BridgeEndBlocker implements EndBlocker {

    private final DepositIngestionService ingestionService;
    private final BatchDepositScanner scanner;
    private final WithdrawalService withdrawalService;
    private final BridgeProperties bridgeProps;
    private final String validatorKey;

    public BridgeEndBlocker(DepositIngestionService ingestionService,
                            BatchDepositScanner scanner,
                            WithdrawalService withdrawalService,
                            WithdrawalSigner signer,
                            BridgeProperties bridgeProps,
                            WithdrawalProperties withdrawalProps) {
        this.ingestionService = ingestionService;
        this.scanner = scanner;
        this.withdrawalService = withdrawalService;
        this.bridgeProps = bridgeProps;
        this.validatorKey = resolveValidatorKey(withdrawalProps, signer);
    }

    @Override
    public void endBlock(BlockContext ctx) {
        if (bridgeProps.isEnabled()) {
            ingestionService.syncDeposits(ctx);
            scanner.scan(ctx);
        }

        if (validatorKey != null) {
            int signed = withdrawalService.signPending(ctx, validatorKey);
            if (signed > 0) {
                log.info("Auto-signed {} pending withdrawal(s) at height {}", signed, ctx.getHeight());
            }
        }
    }

    public boolean isAutoSignEnabled() {
        return validatorKey != null;
    }

    private static String resolveValidatorKey(WithdrawalProperties props, WithdrawalSigner signer) {
        String key = props.getValidatorPrivateKey();
        if (!props.isAutoSign() || key == null || key.isBlank()) {
            log.info("Withdrawal auto-signing disabled");
            return null;
        }
        try {
            log.info("Withdrawal auto-signing enabled: validator={}", signer.addressOf(key));
            return key.trim();
        } catch (InvalidSignerKeyException e) {
            log.error("Invalid withdrawal.validator-private-key, auto-signing disabled: {}", e.getMessage());
            return null;
        }
    }
}
