package top.dhc.netsql.client;

import com.google.common.base.Preconditions;

/**
 * 建立连接时的可选参数
 *
 * 超时为 0 表示一直等待。
 */
public final class ConnectOptions {
    public static final ConnectOptions DEFAULT = builder().build();

    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final ResultSetProcessor processor;

    private ConnectOptions(Builder b) {
        this.connectTimeoutMillis = b.connectTimeoutMillis;
        this.readTimeoutMillis = b.readTimeoutMillis;
        this.processor = b.processor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public ResultSetProcessor getProcessor() {
        return processor;
    }

    public static final class Builder {
        private int connectTimeoutMillis;
        private int readTimeoutMillis;
        private ResultSetProcessor processor = new ResultSetProcessor();

        private Builder() {
        }

        public Builder connectTimeoutMillis(int millis) {
            Preconditions.checkArgument(millis >= 0, "timeout must not be negative");
            this.connectTimeoutMillis = millis;
            return this;
        }

        public Builder readTimeoutMillis(int millis) {
            Preconditions.checkArgument(millis >= 0, "timeout must not be negative");
            this.readTimeoutMillis = millis;
            return this;
        }

        public Builder processor(ResultSetProcessor processor) {
            this.processor = Preconditions.checkNotNull(processor);
            return this;
        }

        public ConnectOptions build() {
            return new ConnectOptions(this);
        }
    }
}
