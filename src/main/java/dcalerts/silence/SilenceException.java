package dcalerts.silence;

import dcalerts.aggregation.DcAlertsException;

/**
 * 静默操作失败。clientError 为 true 表示请求本身不合法
 */
public class SilenceException extends DcAlertsException {
    private final boolean clientError;

    public SilenceException(String message, boolean clientError) {
        super(message);
        this.clientError = clientError;
    }

    public SilenceException(String message, Throwable cause) {
        super(message, cause);
        this.clientError = false;
    }

    public static SilenceException badRequest(String message) {
        return new SilenceException(message, true);
    }

    public boolean isClientError() {
        return clientError;
    }
}
