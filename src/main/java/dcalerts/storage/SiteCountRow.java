package dcalerts.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 每周期每站点一条的计数记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteCountRow {
    private Instant ts;
    private String site;
    private int active;         // 未被静默
    private int suppressed;     // 被静默
    private int total;          // active + suppressed
}
