package dcalerts.report;

import dcalerts.aggregation.DcAlertsException;

/**
 * 报表查询失败，不返回部分结果
 */
public class ReportQueryException extends DcAlertsException {
    public ReportQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
