package dcalerts.storage;

import dcalerts.aggregation.DcAlertsException;

/**
 * 快照写入失败，整个刷新周期视为失败
 */
public class PersistenceException extends DcAlertsException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
