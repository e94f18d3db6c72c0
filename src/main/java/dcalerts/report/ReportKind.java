package dcalerts.report;

/**
 * 报表周期类型
 */
public enum ReportKind {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String period;

    ReportKind(String period) {
        this.period = period;
    }

    public String getPeriod() {
        return period;
    }
}
