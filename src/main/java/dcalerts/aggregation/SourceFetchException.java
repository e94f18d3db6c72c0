package dcalerts.aggregation;

/**
 * 单个数据源拉取失败
 */
public class SourceFetchException extends DcAlertsException {
    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
