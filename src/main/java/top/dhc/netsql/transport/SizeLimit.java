package top.dhc.netsql.transport;

import com.google.common.base.Preconditions;

/**
 * 编解码时单个值允许的最大字节数
 *
 * 控制类数据包（标记、问候、登录、命令）使用 {@link #CONTROL}，
 * 结果集等大块数据使用 {@link #INFINITE}。
 */
public final class SizeLimit {
    /** 控制类数据包的上限 */
    public static final int CONTROL_BOUND = 1024;

    public static final SizeLimit INFINITE = new SizeLimit(-1);
    public static final SizeLimit CONTROL = new SizeLimit(CONTROL_BOUND);

    // 上限字节数，INFINITE 时为 -1
    private final long bound;

    private SizeLimit(long bound) {
        this.bound = bound;
    }

    public static SizeLimit bounded(long bound) {
        Preconditions.checkArgument(bound >= 0, "bound must not be negative: %s", bound);
        return new SizeLimit(bound);
    }

    public boolean isBounded() {
        return bound >= 0;
    }

    /**
     * @throws IllegalStateException 如果是 INFINITE
     */
    public long getBound() {
        Preconditions.checkState(isBounded(), "infinite limit has no bound");
        return bound;
    }

    /**
     * 判断总共 size 字节是否在限制之内
     */
    public boolean allows(long size) {
        return bound < 0 || size <= bound;
    }

    @Override
    public String toString() {
        return isBounded() ? "Bounded(" + bound + ")" : "Infinite";
    }
}
