package dcalerts.aggregation;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 最新告警视图的持有者
 *
 * <p>视图本身不可变，锁只在读取引用和整体替换时持有，绝不跨越网络或存储调用。</p>
 */
public class AlertViewCache {
    private final ReentrantLock lock = new ReentrantLock();
    private AlertView current;

    public AlertViewCache(SiteTable siteTable) {
        this.current = AlertView.empty(siteTable);
    }

    public AlertView get() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    public void publish(AlertView view) {
        lock.lock();
        try {
            current = view;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 周期失败：保留旧视图，只记录错误
     */
    public void recordError(String error) {
        lock.lock();
        try {
            current = current.withLastError(error);
        } finally {
            lock.unlock();
        }
    }
}
