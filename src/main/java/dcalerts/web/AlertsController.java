package dcalerts.web;

import dcalerts.aggregation.AlertView;
import dcalerts.aggregation.HealthStatus;
import dcalerts.aggregation.SiteTable;
import dcalerts.aggregation.SnapshotAggregator;
import dcalerts.report.ReportKind;
import dcalerts.report.WindowReport;
import dcalerts.report.WindowReportBuilder;
import dcalerts.silence.SilenceRequest;
import dcalerts.silence.SilenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 告警看板 HTTP 接口，只做参数转换
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AlertsController {
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes");

    private final SnapshotAggregator aggregator;
    private final WindowReportBuilder reportBuilder;
    private final SilenceService silenceService;
    private final SiteTable siteTable;
    private final Clock clock;

    @GetMapping("/api/alerts")
    public Map<String, Object> alerts(@RequestParam(value = "q", required = false) String q,
                                      @RequestParam(value = "force", defaultValue = "0") String force) {
        AlertView view = TRUTHY.contains(force) ? aggregator.refresh() : aggregator.currentView();
        view = view.filter(q);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generated_at", view.getGeneratedAt() != null ? view.getGeneratedAt().toString() : clock.instant().toString());
        body.put("by_dc", view.getBySite());
        body.put("sources", view.getSources());
        return body;
    }

    @GetMapping("/api/report/daily")
    public WindowReport daily(@RequestParam(value = "y", required = false) Integer y,
                              @RequestParam(value = "m", required = false) Integer m,
                              @RequestParam(value = "d", required = false) Integer d) {
        return reportBuilder.build(ReportKind.DAILY, localDay(y, m, d));
    }

    @GetMapping("/api/report/weekly")
    public WindowReport weekly(@RequestParam(value = "y", required = false) Integer y,
                               @RequestParam(value = "m", required = false) Integer m,
                               @RequestParam(value = "d", required = false) Integer d) {
        return reportBuilder.build(ReportKind.WEEKLY, localDay(y, m, d));
    }

    @GetMapping("/api/report/monthly")
    public WindowReport monthly(@RequestParam(value = "y", required = false) Integer y,
                                @RequestParam(value = "m", required = false) Integer m) {
        LocalDate today = reportBuilder.today();
        return reportBuilder.monthly(YearMonth.of(
                y != null ? y : today.getYear(),
                m != null ? m : today.getMonthValue()));
    }

    @PostMapping("/api/silence")
    public Map<String, Object> silence(@RequestBody SilenceRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("result", silenceService.createOrUpdate(request));
        return body;
    }

    @PostMapping("/api/unsilence")
    public Map<String, Object> unsilence(@RequestBody SilenceRequest request) {
        silenceService.unsilence(request.getGrafana(), request.getId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        return body;
    }

    @GetMapping("/healthz")
    public HealthStatus healthz() {
        return HealthStatus.from(aggregator.currentView());
    }

    @GetMapping("/api/sites")
    public List<String> sites() {
        return siteTable.getCanonical();
    }

    /**
     * 缺省的年月日取报表时区下的今天
     */
    private LocalDate localDay(Integer y, Integer m, Integer d) {
        LocalDate today = reportBuilder.today();
        return LocalDate.of(
                y != null ? y : today.getYear(),
                m != null ? m : today.getMonthValue(),
                d != null ? d : today.getDayOfMonth());
    }
}
