package dcalerts.aggregation;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * 告警状态及其合并优先级
 */
public enum AlertState {
    FIRING("firing", 3),
    ACTIVE("active", 2),
    SUPPRESSED("suppressed", 1),
    UNKNOWN("", 0);

    private final String value;
    private final int rank;

    AlertState(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public static AlertState of(String status) {
        String normalized = StringUtils.lowerCase(StringUtils.trimToEmpty(status), Locale.ROOT);
        for (AlertState state : values()) {
            if (state != UNKNOWN && state.value.equals(normalized)) {
                return state;
            }
        }
        return UNKNOWN;
    }

    public static int rank(String status) {
        return of(status).rank;
    }

    /**
     * 报表里视为"已触发"的状态
     */
    public static boolean isFiringLike(String status) {
        AlertState state = of(status);
        return state == FIRING || state == ACTIVE;
    }
}
