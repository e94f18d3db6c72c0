package dcalerts.report;

import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * 半开区间 [start, end)，边界由本地日历日期按固定时区换算为 UTC
 */
@Getter
public final class ReportWindow {
    private final ReportKind kind;
    private final Instant start;
    private final Instant end;

    public ReportWindow(ReportKind kind, Instant start, Instant end) {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("窗口起点必须早于终点: " + start + " >= " + end);
        }
        this.kind = kind;
        this.start = start;
        this.end = end;
    }

    /**
     * 本地日历日当天
     */
    public static ReportWindow daily(LocalDate day, ZoneId zone) {
        return new ReportWindow(ReportKind.DAILY,
                day.atStartOfDay(zone).toInstant(),
                day.plusDays(1).atStartOfDay(zone).toInstant());
    }

    /**
     * 截止到 endDay 当天结束的 7 天
     */
    public static ReportWindow weekly(LocalDate endDay, ZoneId zone) {
        LocalDate next = endDay.plusDays(1);
        return new ReportWindow(ReportKind.WEEKLY,
                next.minusDays(7).atStartOfDay(zone).toInstant(),
                next.atStartOfDay(zone).toInstant());
    }

    /**
     * 完整的本地自然月
     */
    public static ReportWindow monthly(YearMonth month, ZoneId zone) {
        return new ReportWindow(ReportKind.MONTHLY,
                month.atDay(1).atStartOfDay(zone).toInstant(),
                month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant());
    }

    @Override
    public String toString() {
        return kind.getPeriod() + "[" + start + ", " + end + ")";
    }
}
