package dao.b52.bridge.controller;

import dao.b52.bridge.exception.BridgeException;
import dao.b52.bridge.exception.BridgeReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps bridge failures to the {status, error, code} response body used by all endpoints.
 */
@Slf4j
final class ErrorResponses {
    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> of(String operation, Exception e) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ERROR");
        response.put("error", e.getMessage());

        HttpStatus status;
        if (e instanceof BridgeException) {
            BridgeException be = (BridgeException) e;
            response.put("code", be.getCode());
            status = statusFor(be.getCode());
            log.info("{} rejected: code={}, message={}", operation, be.getCode(), be.getMessage());
        } else if (e instanceof BridgeReadException) {
            response.put("code", "settlement_chain_unavailable");
            status = HttpStatus.SERVICE_UNAVAILABLE;
            log.warn("{} failed, settlement chain unavailable: {}", operation, e.getMessage());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("{} failed", operation, e);
        }
        return ResponseEntity.status(status).body(response);
    }

    static HttpStatus statusFor(String code) {
        switch (code) {
            case "withdrawal_not_found":
            case "deposit_not_found":
                return HttpStatus.NOT_FOUND;
            case "deposit_already_processed":
            case "invalid_withdrawal_state":
            case "invalid_state_import":
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }
}
