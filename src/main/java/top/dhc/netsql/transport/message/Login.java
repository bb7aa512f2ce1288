package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * 登录信息（Login）
 *
 * 客户端在握手阶段发送一次，之后由客户端保留以便查询当前用户名；
 * 服务器只在授权期间使用它。
 */
public final class Login implements Payload {
    private final String username;
    private final String password;

    public Login(String username, String password) {
        this.username = Preconditions.checkNotNull(username, "username");
        this.password = Preconditions.checkNotNull(password, "password");
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.LOGIN;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Login)) {
            return false;
        }
        Login other = (Login) o;
        return username.equals(other.username) && password.equals(other.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, password);
    }

    // 不输出密码
    @Override
    public String toString() {
        return "Login{username='" + username + "'}";
    }
}
