package dcalerts.aggregation;

/**
 * 告警聚合异常基类
 */
public class DcAlertsException extends RuntimeException {
    public DcAlertsException(String message) {
        super(message);
    }

    public DcAlertsException(String message, Throwable cause) {
        super(message, cause);
    }
}
