package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.exception.BridgeReadException;
import dao.b52.bridge.model.DepositRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bridge contract reader over JSON-RPC eth_call.
 * <p>
 * Contract surface used:
 * - deposits(uint256) returns (string account, uint256 amount)
 * - depositIndex() returns (uint256)
 */
@Slf4j
@Service
public class BridgeContractReaderWeb3j implements BridgeContractReader {

    private final Web3j web3j;
    private final String contractAddress;
    private final long timeoutMs;

    public BridgeContractReaderWeb3j(Web3j web3j, BridgeProperties props) {
        this.web3j = web3j;
        this.contractAddress = props.getContractAddress();
        this.timeoutMs = props.getRpcTimeoutMs();
        if (contractAddress == null || contractAddress.isBlank()) {
            log.warn("No bridge.contract-address configured. Deposit reads will fail until it is set.");
        }
    }

    @Override
    public Optional<DepositRecord> findDeposit(long index, Long height) {
        Function fn = depositsFunction(index);
        EthCall result = call(fn, height, "deposits(" + index + ")");
        if (result.hasError()) {
            if (isRevert(result.getError())) {
                log.debug("deposits({}) reverted at height {}: {}", index, height, result.getError().getMessage());
                return Optional.empty();
            }
            throw new BridgeReadException("deposits(" + index + ") failed: " + result.getError().getMessage());
        }
        long atHeight = height == null ? 0L : height;
        return decodeDeposit(index, atHeight, result.getValue());
    }

    @Override
    public long currentBlockNumber() {
        EthBlockNumber blockNumber = send(web3j.ethBlockNumber(), "eth_blockNumber");
        if (blockNumber.hasError()) {
            throw new BridgeReadException("eth_blockNumber failed: " + blockNumber.getError().getMessage());
        }
        return blockNumber.getBlockNumber().longValueExact();
    }

    @Override
    public long highestDepositIndex(long height) {
        Function fn = new Function(
                "depositIndex",
                Collections.emptyList(),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
        EthCall result = call(fn, height, "depositIndex()");
        if (result.hasError()) {
            throw new BridgeReadException("depositIndex() failed: " + result.getError().getMessage());
        }
        List<Type> decoded = FunctionReturnDecoder.decode(result.getValue(), fn.getOutputParameters());
        if (decoded.isEmpty()) {
            // contract not deployed yet at this height
            return 0L;
        }
        BigInteger value = (BigInteger) decoded.get(0).getValue();
        return value.min(BigInteger.valueOf(Long.MAX_VALUE)).longValue();
    }

    /**
     * Decode the raw return data of deposits(uint256). Empty data or an empty account means the record does not exist.
     */
    public static Optional<DepositRecord> decodeDeposit(long index, long atHeight, String rawResult) {
        if (rawResult == null) return Optional.empty();
        String clean = rawResult.startsWith("0x") ? rawResult.substring(2) : rawResult;
        if (clean.isEmpty()) return Optional.empty();

        List<Type> decoded = FunctionReturnDecoder.decode(rawResult, depositsFunction(index).getOutputParameters());
        if (decoded.size() != 2) {
            return Optional.empty();
        }
        String account = (String) decoded.get(0).getValue();
        BigInteger amount = (BigInteger) decoded.get(1).getValue();
        if (account == null || account.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DepositRecord(index, account, amount, atHeight));
    }

    private static Function depositsFunction(long index) {
        return new Function(
                "deposits",
                Collections.singletonList(new Uint256(BigInteger.valueOf(index))),
                List.of(
                        new TypeReference<Utf8String>() {},
                        new TypeReference<Uint256>() {}
                )
        );
    }

    private EthCall call(Function fn, Long height, String what) {
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new BridgeReadException(what + " failed: bridge contract address not configured");
        }
        DefaultBlockParameter block = height == null
                ? DefaultBlockParameterName.LATEST
                : DefaultBlockParameter.valueOf(BigInteger.valueOf(height));
        Transaction tx = Transaction.createEthCallTransaction(null, contractAddress, FunctionEncoder.encode(fn));
        return send(web3j.ethCall(tx, block), what);
    }

    private <T extends Response<?>> T send(Request<?, T> request, String what) {
        try {
            return request.sendAsync().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeReadException(what + " interrupted", e);
        } catch (TimeoutException e) {
            throw new BridgeReadException(what + " timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BridgeReadException(what + " failed: " + cause.getMessage(), cause);
        }
    }

    private static boolean isRevert(Response.Error error) {
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("revert");
    }
}
