package dcalerts.web;

import dcalerts.aggregation.DcAlertsException;
import dcalerts.silence.SilenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.DateTimeException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一错误响应 {"ok": false, "error": "..."}
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SilenceException.class)
    public ResponseEntity<Map<String, Object>> handleSilence(SilenceException e) {
        HttpStatus status = e.isClientError() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        return error(status, e.getMessage());
    }

    @ExceptionHandler({DateTimeException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(DcAlertsException.class)
    public ResponseEntity<Map<String, Object>> handleDcAlerts(DcAlertsException e) {
        log.error("请求处理失败: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
